package com.charter.core.render;

import java.nio.file.Path;
import java.util.List;

/**
 * Files touched by a render run.
 *
 * @param written   projections whose content changed and were rewritten
 * @param unchanged projections already up to date
 */
public record RenderReport(List<Path> written, List<Path> unchanged) {

    public RenderReport {
        written = List.copyOf(written);
        unchanged = List.copyOf(unchanged);
    }
}
