package com.charter.core.refs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-driven {@link ReferenceMatcher}. Capture group 1 of the pattern is the id.
 */
public class PatternReferenceMatcher implements ReferenceMatcher {

    /** {@code [[RFC-0001]]}, {@code [[RFC-0001:C-SCOPE]]}, {@code [[WI-2026-01-05-001]]}. */
    public static final String DEFAULT_PATTERN =
            "\\[\\[([A-Za-z]+-[A-Za-z0-9-]+(?::[A-Za-z0-9_-]+)?)\\]\\]";

    private final Pattern pattern;

    public PatternReferenceMatcher(String regex) {
        this(Pattern.compile(regex));
    }

    public PatternReferenceMatcher(Pattern pattern) {
        if (pattern.matcher("").groupCount() < 1) {
            throw new IllegalStateException(
                    "Reference pattern must capture the id in group 1: " + pattern.pattern());
        }
        this.pattern = pattern;
    }

    public static PatternReferenceMatcher defaults() {
        return new PatternReferenceMatcher(DEFAULT_PATTERN);
    }

    @Override
    public List<Mention> find(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Mention> mentions = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String id = m.group(1);
            if (id != null && !id.isEmpty()) {
                mentions.add(new Mention(id, m.start(), m.end()));
            }
        }
        return mentions;
    }
}
