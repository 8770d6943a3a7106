package com.charter.core.refs;

import java.nio.file.Path;

/**
 * A reference found in a file of the external source tree.
 *
 * @param file path relative to the project root
 * @param line 1-based line number
 * @param id   referenced artifact id
 */
public record SourceMention(Path file, int line, String id) {

    public String location() {
        return file.toString().replace('\\', '/') + ":" + line;
    }
}
