package com.charter.core.signature;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The two comment lines that open every rendered projection.
 *
 * @param sourceId  id of the artifact the projection was rendered from
 * @param signature 64 lowercase hex chars, {@code null} when the line is missing
 */
public record ProjectionHeader(String sourceId, String signature) {

    private static final Pattern SOURCE_LINE =
            Pattern.compile("^<!-- GENERATED: do not edit\\. Source: (\\S+) -->$", Pattern.MULTILINE);
    private static final Pattern SIGNATURE_LINE =
            Pattern.compile("^<!-- SIGNATURE: sha256:([0-9a-f]{64}) -->$", Pattern.MULTILINE);

    public String format() {
        return "<!-- GENERATED: do not edit. Source: " + sourceId + " -->\n"
                + "<!-- SIGNATURE: sha256:" + signature + " -->\n";
    }

    /** Parses the header of a projection; empty when the generated marker is absent. */
    public static Optional<ProjectionHeader> parse(String content) {
        Matcher source = SOURCE_LINE.matcher(content);
        if (!source.find()) {
            return Optional.empty();
        }
        Matcher signature = SIGNATURE_LINE.matcher(content);
        return Optional.of(new ProjectionHeader(source.group(1), signature.find() ? signature.group(1) : null));
    }
}
