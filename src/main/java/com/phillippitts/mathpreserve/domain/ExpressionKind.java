package com.phillippitts.mathpreserve.domain;

/**
 * Rendering class of a captured expression.
 */
public enum ExpressionKind {
    /** Flows with the surrounding text ({@code $...$}, {@code \(...\)}). */
    INLINE,
    /** Set apart on its own line ({@code $$...$$}, {@code \[...\]}). */
    DISPLAY,
    /** Named environment such as {@code \begin{align}...\end{align}}. */
    ENVIRONMENT
}
