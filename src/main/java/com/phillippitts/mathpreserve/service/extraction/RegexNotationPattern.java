package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template for pattern families expressed as a single regular expression with a
 * {@code body} named group.
 *
 * <p>Blank bodies are not reported. Subclasses decide the delimiter tag per match.
 */
public abstract class RegexNotationPattern implements NotationPattern {

    private final Pattern pattern;
    private final ExpressionKind kind;

    protected RegexNotationPattern(Pattern pattern, ExpressionKind kind) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public final List<NotationMatch> scan(String source) {
        List<NotationMatch> matches = new ArrayList<>();
        Matcher m = pattern.matcher(source);
        while (m.find()) {
            String body = m.group("body").trim();
            if (body.isEmpty()) {
                continue;
            }
            matches.add(new NotationMatch(m.start(), m.end(), body, kind, delimiterTag(m), name()));
        }
        return matches;
    }

    /**
     * Delimiter tag recorded for the given match.
     */
    protected abstract String delimiterTag(Matcher match);

    @Override
    public String toString() {
        return name() + "[" + pattern.pattern() + "]";
    }
}
