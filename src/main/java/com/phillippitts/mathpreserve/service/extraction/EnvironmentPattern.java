package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Named display environments: {@code \begin{name}...\end{name}} and the starred variants.
 * The closing tag must repeat the opening name and star.
 */
public final class EnvironmentPattern extends RegexNotationPattern {

    public EnvironmentPattern(List<String> environmentNames) {
        super(compile(environmentNames), ExpressionKind.ENVIRONMENT);
    }

    private static Pattern compile(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("At least one environment name is required");
        }
        String alternation = names.stream()
                .map(String::trim)
                .filter(n -> !n.isEmpty())
                .distinct()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\\\begin\\{(?<env>" + alternation + ")(?<star>\\*?)\\}"
                + "(?<body>[\\s\\S]*?)"
                + "\\\\end\\{\\k<env>\\k<star>\\}");
    }

    @Override
    public String name() {
        return "environment";
    }

    @Override
    protected String delimiterTag(Matcher match) {
        return match.group("env") + match.group("star");
    }
}
