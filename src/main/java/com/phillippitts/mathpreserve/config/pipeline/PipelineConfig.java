package com.phillippitts.mathpreserve.config.pipeline;

import com.phillippitts.mathpreserve.config.properties.CoordinatorProperties;
import com.phillippitts.mathpreserve.config.properties.ExtractionProperties;
import com.phillippitts.mathpreserve.config.properties.RegistryProperties;
import com.phillippitts.mathpreserve.service.coordinator.EnhancedCapabilityProvider;
import com.phillippitts.mathpreserve.service.coordinator.ReconstructionCoordinator;
import com.phillippitts.mathpreserve.service.coordinator.StrategySelector;
import com.phillippitts.mathpreserve.service.extraction.DefaultExpressionExtractor;
import com.phillippitts.mathpreserve.service.extraction.ExpressionExtractor;
import com.phillippitts.mathpreserve.service.extraction.FootnoteRegionScanner;
import com.phillippitts.mathpreserve.service.metrics.PreservationMetricsPublisher;
import com.phillippitts.mathpreserve.service.reconstruct.AnnotationReconstructor;
import com.phillippitts.mathpreserve.service.reconstruct.PreambleMacroExtractor;
import com.phillippitts.mathpreserve.service.reconstruct.RegistryReconstructor;
import com.phillippitts.mathpreserve.service.registry.NotationRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the extractor, registry and coordinator explicitly.
 *
 * <p>The enhanced strategy is optional: it is registered only when {@code preserve.enhanced.enabled}
 * is true (the default), and the coordinator discovers it through {@link EnhancedCapabilityProvider}.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExpressionExtractor expressionExtractor(ExtractionProperties props) {
        return new DefaultExpressionExtractor(
                DefaultExpressionExtractor.standardFamilies(props.getEnvironments()),
                new FootnoteRegionScanner(),
                props.getLogPreviewChars());
    }

    /**
     * Application-wide registry singleton; {@code initialise()} runs on bean start.
     */
    @Bean
    public NotationRegistry notationRegistry(RegistryProperties props, Clock clock) {
        return new NotationRegistry(props, clock);
    }

    @Bean
    public PreambleMacroExtractor preambleMacroExtractor() {
        return new PreambleMacroExtractor();
    }

    @Bean
    @ConditionalOnProperty(prefix = "preserve.enhanced", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public RegistryReconstructor registryReconstructor(NotationRegistry registry,
                                                       PreambleMacroExtractor macroExtractor) {
        return new RegistryReconstructor(registry, macroExtractor);
    }

    @Bean
    public StrategySelector strategySelector() {
        return new StrategySelector();
    }

    @Bean
    public ReconstructionCoordinator reconstructionCoordinator(AnnotationReconstructor legacy,
                                                               EnhancedCapabilityProvider capabilities,
                                                               NotationRegistry registry,
                                                               StrategySelector selector,
                                                               ApplicationEventPublisher publisher,
                                                               PreservationMetricsPublisher metrics,
                                                               CoordinatorProperties props) {
        return new ReconstructionCoordinator(legacy, capabilities, registry, selector, publisher, metrics, props);
    }
}
