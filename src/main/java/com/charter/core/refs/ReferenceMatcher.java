package com.charter.core.refs;

import java.util.List;

/**
 * Finds inline references to artifact ids inside free text.
 * Swapping the reference syntax means swapping the matcher.
 */
public interface ReferenceMatcher {

    /** Returns the mentions in {@code text} in order of appearance. */
    List<Mention> find(String text);

    /**
     * One inline reference.
     *
     * @param id    the referenced artifact id
     * @param start offset of the first character of the whole mention
     * @param end   offset after the last character of the whole mention
     */
    record Mention(String id, int start, int end) {}
}
