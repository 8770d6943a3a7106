package com.charter.core.render;

import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.ChangelogCategory;
import com.charter.core.model.ChecklistStatus;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Release;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generates a Keep-a-Changelog file from completed work items.
 * <p>
 * Done acceptance criteria of done work items are grouped by their category.
 * Items not yet shipped feed {@code ## [Unreleased]}; every release feeds
 * {@code ## [version] - date}. Unless forced, released sections already present
 * in the existing file are kept verbatim, and generated entries are merged into the
 * existing Unreleased section: its hand-written entries stay under their headings,
 * entries generated from work items are rebuilt from the store.
 */
@Component
public class ChangelogRenderer {

    static final String PREAMBLE = """
            # Changelog

            All notable changes to this project will be documented in this file.

            The format is based on [Keep a Changelog](https://keepachangelog.com/en/1.1.0/),
            and this project adheres to [Semantic Versioning](https://semver.org/spec/v2.0.0.html).""";

    static final String UNRELEASED = "[Unreleased]";
    static final String NO_CHANGES = "*No changes recorded.*";

    /** An entry written by this renderer: {@code - text (WI-...)}. */
    private static final Pattern GENERATED_ENTRY = Pattern.compile("- .* \\(WI-[A-Za-z0-9-]+\\)");

    /**
     * @param index    current store snapshot
     * @param existing current changelog content, {@code null} when there is none
     * @param force    regenerate every section from the store, dropping hand-written entries
     */
    public String render(GovernanceIndex index, String existing, boolean force) {
        Map<String, String> kept = force || existing == null ? Map.of() : releasedSections(existing);
        Map<String, List<String>> handWritten = force || existing == null ? Map.of() : handWrittenUnreleased(existing);

        List<String> sections = new ArrayList<>();
        sections.add(PREAMBLE);

        List<WorkItem> unreleased = index.workItems().stream()
                .filter(item -> item.status() == WorkItemStatus.DONE)
                .filter(item -> !index.releases().isReleased(item.id()))
                .toList();
        sections.add(section("## " + UNRELEASED, unreleased, handWritten, null));

        List<String> emitted = new ArrayList<>();
        for (Release release : index.releases().releases()) {
            String key = "[" + release.version() + "]";
            emitted.add(key);
            String verbatim = kept.get(key);
            if (verbatim != null) {
                sections.add(verbatim);
            } else {
                List<WorkItem> items = release.refs().stream()
                        .map(index::workItem)
                        .flatMap(Optional::stream)
                        .filter(item -> item.status() == WorkItemStatus.DONE)
                        .toList();
                sections.add(section("## " + key + " - " + release.date(), items, Map.of(), NO_CHANGES));
            }
        }
        // sections of releases the log does not know about are history written by hand
        kept.forEach((key, text) -> {
            if (!emitted.contains(key)) {
                sections.add(text);
            }
        });

        return String.join("\n\n", sections) + "\n";
    }

    /**
     * @param handWritten entries to merge in, keyed by category heading; {@code ""} holds
     *                    lines written before any heading
     * @param whenEmpty   line written when the section has no entries, or {@code null}
     */
    private String section(String heading, List<WorkItem> items, Map<String, List<String>> handWritten,
                           String whenEmpty) {
        Map<String, Set<String>> byHeading = new LinkedHashMap<>();
        for (ChangelogCategory category : ChangelogCategory.values()) {
            if (category.isPublished()) {
                byHeading.put(category.heading(), new LinkedHashSet<>());
            }
        }
        for (WorkItem item : items) {
            for (AcceptanceCriterion criterion : item.acceptanceCriteria()) {
                if (criterion.status() != ChecklistStatus.DONE || !criterion.category().isPublished()) {
                    continue;
                }
                byHeading.get(criterion.category().heading())
                        .add("- " + criterion.text() + " (" + item.id() + ")");
            }
        }
        Set<String> preface = new LinkedHashSet<>(handWritten.getOrDefault("", List.of()));
        handWritten.forEach((category, lines) -> {
            if (!category.isEmpty()) {
                byHeading.computeIfAbsent(category, k -> new LinkedHashSet<>()).addAll(lines);
            }
        });

        StringBuilder out = new StringBuilder(heading);
        boolean empty = preface.isEmpty();
        if (!preface.isEmpty()) {
            out.append("\n\n").append(String.join("\n", preface));
        }
        for (Map.Entry<String, Set<String>> entry : byHeading.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            empty = false;
            out.append("\n\n### ").append(entry.getKey()).append("\n\n");
            out.append(String.join("\n", entry.getValue()));
        }
        if (empty && whenEmpty != null) {
            out.append("\n\n").append(whenEmpty);
        }
        return out.toString();
    }

    /**
     * Entries of the existing Unreleased section that were not generated from work
     * items, keyed by the category heading they appear under.
     */
    static Map<String, List<String>> handWrittenUnreleased(String existing) {
        Map<String, List<String>> notes = new LinkedHashMap<>();
        boolean inside = false;
        String heading = "";
        for (String line : existing.split("\n", -1)) {
            if (line.startsWith("## ")) {
                inside = line.startsWith("## " + UNRELEASED);
                heading = "";
                continue;
            }
            if (!inside || line.isBlank()) {
                continue;
            }
            if (line.startsWith("### ")) {
                heading = line.substring(4).strip();
                continue;
            }
            String entry = line.stripTrailing();
            if (!GENERATED_ENTRY.matcher(entry).matches()) {
                notes.computeIfAbsent(heading, k -> new ArrayList<>()).add(entry);
            }
        }
        return notes;
    }

    /** Splits an existing changelog into its released sections, keyed by {@code [version]}. */
    static Map<String, String> releasedSections(String existing) {
        Map<String, String> sections = new LinkedHashMap<>();
        String key = null;
        StringBuilder current = new StringBuilder();
        for (String line : existing.split("\n", -1)) {
            if (line.startsWith("## [")) {
                store(sections, key, current);
                int close = line.indexOf(']');
                key = close > 0 ? line.substring(3, close + 1) : null;
                current = new StringBuilder();
            }
            if (key != null) {
                current.append(line).append("\n");
            }
        }
        store(sections, key, current);
        sections.remove(UNRELEASED);
        return sections;
    }

    private static void store(Map<String, String> sections, String key, StringBuilder text) {
        if (key != null) {
            sections.put(key, text.toString().stripTrailing());
        }
    }
}
