package com.phillippitts.mathpreserve.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for notation extraction.
 */
@Validated
@ConfigurationProperties(prefix = "preserve.extraction")
public class ExtractionProperties {

    public static final List<String> DEFAULT_ENVIRONMENTS =
            List.of("equation", "align", "gather", "multline", "eqnarray", "alignat");

    /**
     * Display environment names recognised by the environment pattern family. Starred variants are
     * matched automatically.
     */
    @NotEmpty
    private final List<String> environments;

    /**
     * Maximum characters of notation echoed into log messages.
     */
    @Min(0)
    private final int logPreviewChars;

    @ConstructorBinding
    public ExtractionProperties(List<String> environments, Integer logPreviewChars) {
        this.environments = environments == null || environments.isEmpty()
                ? DEFAULT_ENVIRONMENTS : List.copyOf(environments);
        this.logPreviewChars = logPreviewChars == null ? 40 : logPreviewChars;
    }

    /**
     * Defaults for tests and standalone use.
     */
    public ExtractionProperties() {
        this(null, null);
    }

    public List<String> getEnvironments() {
        return environments;
    }

    public int getLogPreviewChars() {
        return logPreviewChars;
    }
}
