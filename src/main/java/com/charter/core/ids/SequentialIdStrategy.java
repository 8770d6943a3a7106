package com.charter.core.ids;

import com.charter.core.model.Adr;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbers artifacts per kind: {@code RFC-0001}, {@code ADR-0002}, {@code WI-0003}.
 */
public class SequentialIdStrategy implements IdStrategy {

    @Override
    public String nextId(ArtifactKind kind, GovernanceIndex index) {
        if (kind == ArtifactKind.CLAUSE) {
            throw new IllegalArgumentException("Clause ids are not allocated");
        }
        Pattern pattern = Pattern.compile(Pattern.quote(kind.prefix()) + "(\\d+)");
        int max = 0;
        for (String id : knownIds(kind, index)) {
            Matcher m = pattern.matcher(id);
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return String.format("%s%04d", kind.prefix(), max + 1);
    }

    static List<String> knownIds(ArtifactKind kind, GovernanceIndex index) {
        List<String> ids = new ArrayList<>();
        switch (kind) {
            case RFC -> index.rfcs().stream().map(RfcDocument::id).forEach(ids::add);
            case ADR -> index.adrs().stream().map(Adr::id).forEach(ids::add);
            case WORK_ITEM -> index.workItems().stream().map(WorkItem::id).forEach(ids::add);
            default -> { }
        }
        index.tombstones().ids().stream()
                .filter(id -> ArtifactKind.ofId(id) == kind)
                .forEach(ids::add);
        return ids;
    }
}
