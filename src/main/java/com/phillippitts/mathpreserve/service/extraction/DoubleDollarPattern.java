package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Display notation between {@code $$} pairs. */
public final class DoubleDollarPattern extends RegexNotationPattern {

    public static final String TAG = "$$";

    private static final Pattern PATTERN = Pattern.compile("(?<!\\\\)\\$\\$(?<body>[\\s\\S]+?)\\$\\$");

    public DoubleDollarPattern() {
        super(PATTERN, ExpressionKind.DISPLAY);
    }

    @Override
    public String name() {
        return "double-dollar";
    }

    @Override
    protected String delimiterTag(Matcher match) {
        return TAG;
    }
}
