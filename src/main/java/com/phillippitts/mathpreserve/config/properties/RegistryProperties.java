package com.phillippitts.mathpreserve.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for registry freshness.
 */
@Validated
@ConfigurationProperties(prefix = "preserve.registry")
public class RegistryProperties {

    /** Age after which an installed generation is treated as stale. */
    @NotNull
    private final Duration maxAge;

    /** Age after which reads log a freshness warning. */
    @NotNull
    private final Duration warnAge;

    @ConstructorBinding
    public RegistryProperties(Duration maxAge, Duration warnAge) {
        this.maxAge = maxAge == null ? Duration.ofMinutes(10) : maxAge;
        this.warnAge = warnAge == null ? Duration.ofMinutes(5) : warnAge;
        if (this.maxAge.isNegative() || this.maxAge.isZero()) {
            throw new IllegalArgumentException("preserve.registry.max-age must be positive");
        }
    }

    public RegistryProperties() {
        this(null, null);
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public Duration getWarnAge() {
        return warnAge;
    }
}
