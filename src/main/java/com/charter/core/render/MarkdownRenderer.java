package com.charter.core.render;

import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.Adr;
import com.charter.core.model.Alternative;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.ChangelogEntry;
import com.charter.core.model.Clause;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.Section;
import com.charter.core.model.WorkItem;
import com.charter.core.refs.ReferenceIndex;
import com.charter.core.refs.ReferenceMatcher;
import com.charter.core.signature.ProjectionHeader;
import com.charter.core.signature.ProjectionPaths;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Renders artifacts to markdown projections.
 * <p>
 * Output depends only on its inputs, so rendering an unchanged artifact twice is
 * byte-identical. Inline mentions of known ids become relative links; unknown
 * mentions are left as written.
 */
@Component
public class MarkdownRenderer {

    public String renderRfc(RfcDocument document, ReferenceIndex refs, String signature) {
        Rfc rfc = document.rfc();
        StringBuilder out = header(rfc.id(), signature);
        out.append("# ").append(rfc.id()).append(": ").append(rfc.title()).append("\n\n");
        out.append("> **Version:** ").append(rfc.version())
                .append(" | **Status:** ").append(rfc.status())
                .append(" | **Phase:** ").append(rfc.phase()).append("\n");
        if (!rfc.owners().isEmpty()) {
            out.append(">\n> **Owners:** ").append(String.join(", ", rfc.owners())).append("\n");
        }
        if (rfc.created() != null) {
            out.append(">\n> **Created:** ").append(rfc.created());
            if (rfc.updated() != null) {
                out.append(" | **Updated:** ").append(rfc.updated());
            }
            out.append("\n");
        }

        int number = 0;
        for (Section section : rfc.sections()) {
            number++;
            out.append("\n---\n\n## ").append(number).append(". ").append(section.title()).append("\n");
            for (String clauseId : section.clauses()) {
                document.clause(clauseId).ifPresent(clause -> appendClause(out, rfc.id(), clause, refs));
            }
        }

        if (!rfc.changelog().isEmpty()) {
            out.append("\n---\n\n## Changelog\n");
            for (ChangelogEntry entry : rfc.changelog()) {
                out.append("\n### v").append(entry.version());
                if (entry.date() != null) {
                    out.append(" (").append(entry.date()).append(")");
                }
                out.append("\n");
                if (entry.summary() != null && !entry.summary().isBlank()) {
                    out.append("\n").append(expandMentions(entry.summary(), refs)).append("\n");
                }
                if (!entry.changes().isEmpty()) {
                    out.append("\n");
                    entry.changes().forEach(change -> out.append("- ").append(expandMentions(change, refs)).append("\n"));
                }
            }
        }
        return out.toString();
    }

    public String renderAdr(Adr adr, ReferenceIndex refs, String signature) {
        StringBuilder out = header(adr.id(), signature);
        out.append("# ").append(adr.id()).append(": ").append(adr.title()).append("\n\n");
        out.append("> **Status:** ").append(adr.status());
        if (adr.date() != null) {
            out.append(" | **Date:** ").append(adr.date());
        }
        out.append("\n");
        if (adr.supersededBy() != null) {
            out.append(">\n> **Superseded by:** ").append(link(adr.supersededBy(), refs)).append("\n");
        }
        appendRefs(out, adr.refs(), refs);
        appendText(out, "Context", adr.context(), refs);
        appendText(out, "Decision", adr.decision(), refs);
        appendText(out, "Consequences", adr.consequences(), refs);

        if (!adr.alternatives().isEmpty()) {
            out.append("\n## Alternatives Considered\n");
            for (Alternative alternative : adr.alternatives()) {
                out.append("\n### ").append(expandMentions(alternative.text(), refs))
                        .append(" (").append(alternative.status()).append(")\n");
                if (!alternative.pros().isEmpty()) {
                    out.append("\n**Pros:**\n\n");
                    alternative.pros().forEach(pro -> out.append("- ").append(expandMentions(pro, refs)).append("\n"));
                }
                if (!alternative.cons().isEmpty()) {
                    out.append("\n**Cons:**\n\n");
                    alternative.cons().forEach(con -> out.append("- ").append(expandMentions(con, refs)).append("\n"));
                }
                if (alternative.rejectionReason() != null && !alternative.rejectionReason().isBlank()) {
                    out.append("\n**Rejected because:** ")
                            .append(expandMentions(alternative.rejectionReason(), refs)).append("\n");
                }
            }
        }
        return out.toString();
    }

    public String renderWorkItem(WorkItem item, ReferenceIndex refs, String signature) {
        StringBuilder out = header(item.id(), signature);
        out.append("# ").append(item.id()).append(": ").append(item.title()).append("\n\n");
        out.append("> **Status:** ").append(item.status());
        appendDate(out, "Created", item.created());
        appendDate(out, "Started", item.started());
        appendDate(out, "Completed", item.completed());
        out.append("\n");
        appendRefs(out, item.refs(), refs);
        appendText(out, "Description", item.description(), refs);

        if (!item.acceptanceCriteria().isEmpty()) {
            out.append("\n## Acceptance Criteria\n\n");
            for (AcceptanceCriterion criterion : item.acceptanceCriteria()) {
                String text = expandMentions(criterion.displayText(), refs);
                switch (criterion.status()) {
                    case PENDING -> out.append("- [ ] ").append(text).append("\n");
                    case DONE -> out.append("- [x] ").append(text).append("\n");
                    case CANCELLED -> out.append("- ~~").append(text).append("~~\n");
                }
            }
        }
        if (!item.notes().isEmpty()) {
            out.append("\n## Notes\n\n");
            item.notes().forEach(note -> out.append("- ").append(expandMentions(note, refs)).append("\n"));
        }
        return out.toString();
    }

    /** Replaces every mention of a known id with a markdown link to its projection. */
    public String expandMentions(String text, ReferenceIndex refs) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        List<ReferenceMatcher.Mention> mentions = refs.matcher().find(text);
        if (mentions.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int cursor = 0;
        for (ReferenceMatcher.Mention mention : mentions) {
            out.append(text, cursor, mention.start());
            if (refs.isKnown(mention.id())) {
                out.append(link(mention.id(), refs));
            } else {
                out.append(text, mention.start(), mention.end());
            }
            cursor = mention.end();
        }
        out.append(text.substring(cursor));
        return out.toString();
    }

    static String anchor(String clauseId) {
        return clauseId.toLowerCase(Locale.ROOT);
    }

    private void appendClause(StringBuilder out, String rfcId, Clause clause, ReferenceIndex refs) {
        out.append("\n<a id=\"").append(anchor(clause.id())).append("\"></a>\n");
        out.append("### [").append(clause.id()).append("] ").append(clause.title()).append("\n\n");
        out.append("*").append(clause.kind()).append("* | *").append(clause.status()).append("*");
        if (clause.since() != null) {
            out.append(" | Since v").append(clause.since());
        }
        out.append("\n\n").append(expandMentions(clause.text(), refs)).append("\n");
        if (clause.supersededBy() != null) {
            String target = clause.supersededBy();
            String qualified = target.indexOf(ArtifactKind.CLAUSE_SEPARATOR) > 0
                    ? target : ArtifactKind.qualifyClause(rfcId, target);
            out.append("\n> **Superseded by:** ").append(link(qualified, refs)).append("\n");
        }
    }

    private void appendRefs(StringBuilder out, List<String> ids, ReferenceIndex refs) {
        if (ids.isEmpty()) {
            return;
        }
        out.append("\n## References\n\n");
        ids.forEach(id -> out.append("- ").append(link(id, refs)).append("\n"));
    }

    private void appendText(StringBuilder out, String heading, String text, ReferenceIndex refs) {
        if (text == null || text.isBlank()) {
            return;
        }
        out.append("\n## ").append(heading).append("\n\n").append(expandMentions(text, refs)).append("\n");
    }

    private static void appendDate(StringBuilder out, String label, LocalDate date) {
        if (date != null) {
            out.append(" | **").append(label).append(":** ").append(date);
        }
    }

    private static StringBuilder header(String id, String signature) {
        return new StringBuilder(new ProjectionHeader(id, signature).format()).append("\n");
    }

    private static String link(String id, ReferenceIndex refs) {
        if (!refs.isKnown(id)) {
            return "`" + id + "`";
        }
        ArtifactKind kind = ArtifactKind.ofId(id);
        if (kind == ArtifactKind.CLAUSE) {
            int separator = id.indexOf(ArtifactKind.CLAUSE_SEPARATOR);
            String rfcId = id.substring(0, separator);
            return "[" + id + "](" + ProjectionPaths.relativeLink(ArtifactKind.RFC, rfcId)
                    + "#" + anchor(id.substring(separator + 1)) + ")";
        }
        return "[" + id + "](" + ProjectionPaths.relativeLink(kind, id) + ")";
    }
}
