package com.charter.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A versioned specification made of ordered sections of clauses.
 * <p>
 * Clause bodies live in their own records; sections only carry clause ids.
 *
 * @param id                identifier, e.g. {@code RFC-0001}
 * @param title             human readable title
 * @param version           semantic version, e.g. {@code 1.2.0}
 * @param status            lifecycle status
 * @param phase             delivery phase
 * @param owners            owning people or teams
 * @param created           creation date
 * @param updated           date of the last content change, may be {@code null}
 * @param sections          ordered sections
 * @param changelog         version history, newest first
 * @param releasedSignature signature of the content at the last released version,
 *                          {@code null} until the RFC first becomes normative
 */
public record Rfc(
        String id,
        String title,
        String version,
        RfcStatus status,
        RfcPhase phase,
        List<String> owners,
        LocalDate created,
        LocalDate updated,
        List<Section> sections,
        List<ChangelogEntry> changelog,
        String releasedSignature
) {

    public Rfc {
        owners = owners == null ? List.of() : List.copyOf(owners);
        sections = sections == null ? List.of() : List.copyOf(sections);
        changelog = changelog == null ? List.of() : List.copyOf(changelog);
    }

    /** All clause ids listed by the sections, in reading order, duplicates included. */
    public List<String> clauseIds() {
        List<String> ids = new ArrayList<>();
        for (Section section : sections) {
            ids.addAll(section.clauses());
        }
        return ids;
    }

    public Rfc withStatus(RfcStatus newStatus) {
        return new Rfc(id, title, version, newStatus, phase, owners, created, updated,
                sections, changelog, releasedSignature);
    }

    public Rfc withPhase(RfcPhase newPhase) {
        return new Rfc(id, title, version, status, newPhase, owners, created, updated,
                sections, changelog, releasedSignature);
    }

    public Rfc withUpdated(LocalDate date) {
        return new Rfc(id, title, version, status, phase, owners, created, date,
                sections, changelog, releasedSignature);
    }

    public Rfc withSections(List<Section> newSections) {
        return new Rfc(id, title, version, status, phase, owners, created, updated,
                newSections, changelog, releasedSignature);
    }

    public Rfc withReleasedSignature(String signature) {
        return new Rfc(id, title, version, status, phase, owners, created, updated,
                sections, changelog, signature);
    }

    /** Records a new version with its changelog entry prepended. */
    public Rfc withRelease(String newVersion, ChangelogEntry entry, LocalDate date) {
        List<ChangelogEntry> entries = new ArrayList<>();
        entries.add(entry);
        entries.addAll(changelog);
        return new Rfc(id, title, newVersion, status, phase, owners, created, date,
                sections, entries, releasedSignature);
    }
}
