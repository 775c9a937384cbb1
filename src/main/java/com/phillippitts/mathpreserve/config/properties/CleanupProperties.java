package com.phillippitts.mathpreserve.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for render-tree cleanup and its health thresholds.
 */
@Validated
@ConfigurationProperties(prefix = "preserve.cleanup")
public class CleanupProperties {

    /** CSS selector of the region holding the live rendered output. */
    @NotBlank
    private final String outputSelector;

    private final boolean memoryHintEnabled;

    /** Delay before a deferred pass is attempted again. */
    @NotNull
    private final Duration retryDelay;

    @Min(0)
    private final int maxRetries;

    @Min(1)
    private final int maxTotalNodes;

    @Min(0)
    private final int maxTemporaryNodes;

    @Min(0)
    private final int maxEmptyNodes;

    @ConstructorBinding
    public CleanupProperties(String outputSelector,
                             Boolean memoryHintEnabled,
                             Duration retryDelay,
                             Integer maxRetries,
                             Integer maxTotalNodes,
                             Integer maxTemporaryNodes,
                             Integer maxEmptyNodes) {
        this.outputSelector = outputSelector == null || outputSelector.isBlank() ? "#output" : outputSelector;
        this.memoryHintEnabled = memoryHintEnabled == null || memoryHintEnabled;
        this.retryDelay = retryDelay == null ? Duration.ofSeconds(2) : retryDelay;
        this.maxRetries = maxRetries == null ? 1 : maxRetries;
        this.maxTotalNodes = maxTotalNodes == null ? 5000 : maxTotalNodes;
        this.maxTemporaryNodes = maxTemporaryNodes == null ? 10 : maxTemporaryNodes;
        this.maxEmptyNodes = maxEmptyNodes == null ? 50 : maxEmptyNodes;
    }

    public CleanupProperties() {
        this(null, null, null, null, null, null, null);
    }

    public String getOutputSelector() {
        return outputSelector;
    }

    public boolean isMemoryHintEnabled() {
        return memoryHintEnabled;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxTotalNodes() {
        return maxTotalNodes;
    }

    public int getMaxTemporaryNodes() {
        return maxTemporaryNodes;
    }

    public int getMaxEmptyNodes() {
        return maxEmptyNodes;
    }
}
