package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Display notation between {@code \[} and {@code \]}. A {@code \\[} line-break spacing argument is
 * not an opener.
 */
public final class BracketDisplayPattern extends RegexNotationPattern {

    public static final String TAG = "\\[\\]";

    private static final Pattern PATTERN = Pattern.compile("(?<!\\\\)\\\\\\[(?<body>[\\s\\S]+?)\\\\\\]");

    public BracketDisplayPattern() {
        super(PATTERN, ExpressionKind.DISPLAY);
    }

    @Override
    public String name() {
        return "bracket-display";
    }

    @Override
    protected String delimiterTag(Matcher match) {
        return TAG;
    }
}
