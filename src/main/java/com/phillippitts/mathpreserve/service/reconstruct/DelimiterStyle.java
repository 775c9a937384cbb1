package com.phillippitts.mathpreserve.service.reconstruct;

import com.phillippitts.mathpreserve.domain.ExpressionKind;
import com.phillippitts.mathpreserve.domain.ExpressionRecord;

import java.util.regex.Pattern;

/**
 * Wraps notation in delimiters, either restoring a captured record's original delimiter or
 * choosing one from what the rendered node tells us.
 */
public final class DelimiterStyle {

    private static final Pattern HAS_ENVIRONMENT = Pattern.compile("^\\s*\\\\begin\\{[^}]+}");

    private DelimiterStyle() {
    }

    /**
     * Restores the delimiter the record was captured with.
     */
    public static String restore(ExpressionRecord record) {
        String body = record.rawNotation();
        return switch (record.kind()) {
            case INLINE -> "$".equals(record.delimiterTag()) ? "$" + body + "$" : "\\(" + body + "\\)";
            case DISPLAY -> "$$".equals(record.delimiterTag()) ? "$$" + body + "$$" : "\\[" + body + "\\]";
            case ENVIRONMENT -> environment(record.delimiterTag(), body);
        };
    }

    /**
     * Chooses delimiters for notation recovered from an annotation.
     *
     * <p>Precedence: a stored environment name, an environment already present in the notation,
     * alignment plus line breaks ({@code align*}), line breaks alone ({@code gather*}), then
     * {@code \[..\]} for display and {@code \(..\)} for inline notation.
     *
     * @param notation annotation text
     * @param display whether the node was rendered as display math
     * @param storedEnvironment environment name stored on the node, may be null
     */
    public static String wrap(String notation, boolean display, String storedEnvironment) {
        if (isUsableEnvironment(storedEnvironment)) {
            return environment(storedEnvironment, notation);
        }
        if (HAS_ENVIRONMENT.matcher(notation).find()) {
            return notation;
        }
        boolean alignment = notation.contains("&");
        boolean lineBreaks = notation.contains("\\\\") || notation.contains("\\\n");
        if (alignment && lineBreaks) {
            return environment("align*", notation);
        }
        if (lineBreaks) {
            return environment("gather*", notation);
        }
        return display ? "\\[" + notation + "\\]" : "\\(" + notation + "\\)";
    }

    static boolean isUsableEnvironment(String name) {
        return name != null && !name.isBlank() && !name.startsWith("{") && !name.startsWith("[");
    }

    private static String environment(String name, String body) {
        return "\\begin{" + name + "}\n" + body + "\n\\end{" + name + "}";
    }
}
