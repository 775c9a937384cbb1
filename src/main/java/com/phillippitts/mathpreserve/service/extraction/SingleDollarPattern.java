package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline notation between single {@code $} characters. Lookarounds keep it from matching either
 * half of a {@code $$} pair; an escaped {@code \$} never opens and never closes.
 */
public final class SingleDollarPattern extends RegexNotationPattern {

    public static final String TAG = "$";

    private static final Pattern PATTERN = Pattern.compile(
            "(?<![\\\\$])\\$(?<body>(?:\\\\[\\s\\S]|[^$\\\\])+?)\\$(?!\\$)");

    public SingleDollarPattern() {
        super(PATTERN, ExpressionKind.INLINE);
    }

    @Override
    public String name() {
        return "single-dollar";
    }

    @Override
    protected String delimiterTag(Matcher match) {
        return TAG;
    }
}
