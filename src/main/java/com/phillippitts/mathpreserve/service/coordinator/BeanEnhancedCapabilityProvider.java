package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.service.reconstruct.ReconstructionStrategy;
import com.phillippitts.mathpreserve.service.reconstruct.RegistryReconstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Looks the enhanced strategy up in the application context, where it exists only when
 * {@code preserve.enhanced.enabled} is true.
 */
@Component
class BeanEnhancedCapabilityProvider implements EnhancedCapabilityProvider {

    private final ObjectProvider<RegistryReconstructor> enhanced;

    BeanEnhancedCapabilityProvider(ObjectProvider<RegistryReconstructor> enhanced) {
        this.enhanced = enhanced;
    }

    @Override
    public Optional<ReconstructionStrategy> resolve() {
        return Optional.ofNullable(enhanced.getIfAvailable());
    }
}
