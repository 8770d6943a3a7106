package com.charter.core.edit;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A field address: {@code title}, or an entry field of a list such as
 * {@code alternatives[0].pros} (negative indexes count from the end).
 *
 * @param name     top-level field name
 * @param index    list entry index, {@code null} for a top-level field
 * @param subField field of the list entry, {@code null} for a top-level field
 */
public record FieldPath(String name, Integer index, String subField) {

    private static final Pattern FORMAT =
            Pattern.compile("([a-z_]+)(?:\\[(-?\\d+)]\\.([a-z_]+))?");

    public static FieldPath parse(String artifactId, String path) {
        Matcher m = FORMAT.matcher(path == null ? "" : path.strip());
        if (!m.matches()) {
            throw new EditRejectedException(artifactId, "malformed field path '" + path + "'");
        }
        if (m.group(2) == null) {
            return new FieldPath(m.group(1), null, null);
        }
        return new FieldPath(m.group(1), Integer.parseInt(m.group(2)), m.group(3));
    }

    public boolean isNested() {
        return index != null;
    }

    /** Registry key with the index elided, e.g. {@code alternatives[].pros}. */
    public String schemaKey() {
        return isNested() ? name + "[]." + subField : name;
    }

    @Override
    public String toString() {
        return isNested() ? name + "[" + index + "]." + subField : name;
    }
}
