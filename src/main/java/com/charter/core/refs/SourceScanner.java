package com.charter.core.refs;

import com.charter.core.store.StoreIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks the configured source roots and reports every inline reference with its
 * file and line. Files are only read, never modified.
 * <p>
 * Common build-tool and IDE directories are always skipped, in addition to the
 * configured exclusions.
 */
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next"
    );

    private final SourceScanOptions options;

    public SourceScanner(SourceScanOptions options) {
        this.options = options;
    }

    public boolean isEnabled() {
        return options.enabled();
    }

    /**
     * @param matcher the reference syntax to look for
     * @return mentions ordered by file, then line
     * @throws StoreIoException if a root cannot be walked
     */
    public List<SourceMention> scan(ReferenceMatcher matcher) {
        if (!options.enabled()) {
            return List.of();
        }
        Path projectRoot = options.projectRoot();
        List<Path> files = new ArrayList<>();
        for (String root : options.roots()) {
            Path dir = projectRoot.resolve(root);
            if (!Files.isDirectory(dir)) {
                log.debug("Source root {} does not exist, skipping", dir);
                continue;
            }
            try (Stream<Path> stream = Files.walk(dir)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> !shouldIgnore(projectRoot, p))
                      .filter(this::hasScannedExtension)
                      .forEach(files::add);
            } catch (IOException | UncheckedIOException e) {
                throw new StoreIoException("Failed to walk source root " + dir, e);
            }
        }
        files.sort(null);

        List<SourceMention> mentions = new ArrayList<>();
        for (Path file : files) {
            scanFile(projectRoot, file, matcher, mentions);
        }
        log.debug("Scanned {} source files, found {} references", files.size(), mentions.size());
        return mentions;
    }

    private void scanFile(Path projectRoot, Path file, ReferenceMatcher matcher, List<SourceMention> out) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", file);
            return;
        } catch (IOException e) {
            throw new StoreIoException("Failed to read source file " + file, e);
        }
        Path relative = projectRoot.relativize(file);
        for (int i = 0; i < lines.size(); i++) {
            for (ReferenceMatcher.Mention mention : matcher.find(lines.get(i))) {
                out.add(new SourceMention(relative, i + 1, mention.id()));
            }
        }
    }

    private boolean hasScannedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return options.extensions().contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (IGNORE_DIRS.contains(name) || options.excludeDirs().contains(name)) {
                return true;
            }
        }
        return false;
    }
}
