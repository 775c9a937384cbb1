package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Inline notation between {@code \(} and {@code \)}. */
public final class ParenInlinePattern extends RegexNotationPattern {

    public static final String TAG = "\\(\\)";

    private static final Pattern PATTERN = Pattern.compile("(?<!\\\\)\\\\\\((?<body>[\\s\\S]+?)\\\\\\)");

    public ParenInlinePattern() {
        super(PATTERN, ExpressionKind.INLINE);
    }

    @Override
    public String name() {
        return "paren-inline";
    }

    @Override
    protected String delimiterTag(Matcher match) {
        return TAG;
    }
}
