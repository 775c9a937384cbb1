package com.phillippitts.mathpreserve.service.reconstruct;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds macro declarations in source text with brace-balanced parsing.
 *
 * <p>Recognised forms:
 * <ul>
 *   <li>{@code \newcommand}, {@code \renewcommand}, {@code \providecommand}, with optional
 *       {@code [n]} argument count and {@code [default]} first-argument value</li>
 *   <li>{@code \DeclareMathOperator} and its starred form</li>
 *   <li>{@code \def\name#1#2{...}}</li>
 * </ul>
 * A declaration whose braces never balance is skipped.
 */
public final class PreambleMacroExtractor {

    private static final Logger LOG = LogManager.getLogger(PreambleMacroExtractor.class);

    private static final List<String> NEW_COMMANDS = List.of("\\newcommand", "\\renewcommand", "\\providecommand");
    private static final String OPERATOR = "\\DeclareMathOperator";
    private static final String DEF = "\\def";

    public PreambleMacros extract(String source) {
        List<String> commands = new ArrayList<>();
        Map<String, MacroDefinition> macros = new LinkedHashMap<>();
        if (source == null || source.isEmpty()) {
            return new PreambleMacros(commands, macros);
        }
        int i = 0;
        while (i < source.length()) {
            int next = source.indexOf('\\', i);
            if (next < 0) {
                break;
            }
            int end = tryParse(source, next, commands, macros);
            i = end > next ? end : next + 1;
        }
        LOG.debug("Found {} macro declarations defining {} macros", commands.size(), macros.size());
        return new PreambleMacros(commands, macros);
    }

    private int tryParse(String s, int start, List<String> commands, Map<String, MacroDefinition> macros) {
        for (String keyword : NEW_COMMANDS) {
            if (startsWithWord(s, start, keyword)) {
                return parseNewCommand(s, start, start + keyword.length(), commands, macros);
            }
        }
        if (startsWithWord(s, start, OPERATOR)) {
            return parseOperator(s, start, start + OPERATOR.length(), commands, macros);
        }
        if (startsWithWord(s, start, DEF)) {
            return parseDef(s, start, start + DEF.length(), commands, macros);
        }
        return -1;
    }

    private int parseNewCommand(String s, int start, int pos, List<String> commands,
                                Map<String, MacroDefinition> macros) {
        pos = skipStar(s, skipSpace(s, pos));
        Name name = readName(s, skipSpace(s, pos));
        if (name == null) {
            return -1;
        }
        pos = skipSpace(s, name.end());
        int arguments = 0;
        String defaultArgument = null;
        Group count = readGroup(s, pos, '[', ']');
        if (count != null) {
            try {
                arguments = Integer.parseInt(count.content().trim());
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring non-numeric argument count '{}' for \\{}", count.content(), name.value());
                return -1;
            }
            pos = skipSpace(s, count.end());
            Group dflt = readGroup(s, pos, '[', ']');
            if (dflt != null) {
                defaultArgument = dflt.content();
                pos = skipSpace(s, dflt.end());
            }
        }
        Group body = readGroup(s, pos, '{', '}');
        if (body == null) {
            return -1;
        }
        commands.add(s.substring(start, body.end()));
        macros.put(name.value(), new MacroDefinition(body.content(), arguments, defaultArgument));
        return body.end();
    }

    private int parseOperator(String s, int start, int pos, List<String> commands,
                              Map<String, MacroDefinition> macros) {
        boolean starred = pos < s.length() && s.charAt(pos) == '*';
        pos = skipStar(s, pos);
        Name name = readName(s, skipSpace(s, pos));
        if (name == null) {
            return -1;
        }
        Group body = readGroup(s, skipSpace(s, name.end()), '{', '}');
        if (body == null) {
            return -1;
        }
        String operator = (starred ? "\\operatorname*{" : "\\operatorname{") + body.content() + "}";
        commands.add(s.substring(start, body.end()));
        macros.put(name.value(), new MacroDefinition(operator, 0, null));
        return body.end();
    }

    private int parseDef(String s, int start, int pos, List<String> commands,
                         Map<String, MacroDefinition> macros) {
        Name name = readName(s, skipSpace(s, pos));
        if (name == null || name.braced()) {
            return -1;
        }
        int brace = s.indexOf('{', name.end());
        if (brace < 0) {
            return -1;
        }
        String parameters = s.substring(name.end(), brace);
        int arguments = (int) parameters.chars().filter(c -> c == '#').count();
        Group body = readGroup(s, brace, '{', '}');
        if (body == null) {
            return -1;
        }
        commands.add(s.substring(start, body.end()));
        macros.put(name.value(), new MacroDefinition(body.content(), arguments, null));
        return body.end();
    }

    private static boolean startsWithWord(String s, int index, String keyword) {
        if (!s.startsWith(keyword, index)) {
            return false;
        }
        int after = index + keyword.length();
        return after >= s.length() || !Character.isLetter(s.charAt(after));
    }

    private static int skipSpace(String s, int pos) {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int skipStar(String s, int pos) {
        return pos < s.length() && s.charAt(pos) == '*' ? pos + 1 : pos;
    }

    /**
     * Reads {@code {\name}} or {@code \name}; the returned value has no backslash.
     */
    private static Name readName(String s, int pos) {
        if (pos >= s.length()) {
            return null;
        }
        if (s.charAt(pos) == '{') {
            Group group = readGroup(s, pos, '{', '}');
            if (group == null) {
                return null;
            }
            String raw = group.content().trim();
            if (!raw.startsWith("\\") || raw.length() < 2) {
                return null;
            }
            return new Name(raw.substring(1), group.end(), true);
        }
        if (s.charAt(pos) != '\\') {
            return null;
        }
        int end = pos + 1;
        while (end < s.length() && Character.isLetter(s.charAt(end))) {
            end++;
        }
        if (end == pos + 1) {
            // single non-letter control symbol such as \!
            end = Math.min(pos + 2, s.length());
        }
        if (end == pos + 1) {
            return null;
        }
        return new Name(s.substring(pos + 1, end), end, false);
    }

    /**
     * Reads a balanced group starting at {@code pos}; backslash escapes the next character.
     */
    static Group readGroup(String s, int pos, char open, char close) {
        if (pos >= s.length() || s.charAt(pos) != open) {
            return null;
        }
        int depth = 0;
        for (int j = pos; j < s.length(); j++) {
            char c = s.charAt(j);
            if (c == '\\') {
                j++;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return new Group(s.substring(pos + 1, j), j + 1);
                }
            }
        }
        return null;
    }

    record Group(String content, int end) {
    }

    private record Name(String value, int end, boolean braced) {
    }
}
