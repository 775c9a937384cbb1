package com.phillippitts.mathpreserve.config.properties;

import com.phillippitts.mathpreserve.domain.ProcessingMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for reconstruction strategy selection.
 */
@Validated
@ConfigurationProperties(prefix = "preserve.coordinator")
public class CoordinatorProperties {

    /** Initial processing mode; operators may change it at runtime. */
    @NotNull
    private final ProcessingMode mode;

    @ConstructorBinding
    public CoordinatorProperties(ProcessingMode mode) {
        this.mode = mode == null ? ProcessingMode.AUTO : mode;
    }

    public CoordinatorProperties() {
        this(null);
    }

    public ProcessingMode getMode() {
        return mode;
    }
}
