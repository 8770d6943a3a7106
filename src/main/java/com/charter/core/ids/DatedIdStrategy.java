package com.charter.core.ids;

import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;

import java.time.Clock;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dates work items, {@code WI-2026-03-01-001}, numbering them within the day.
 * RFCs and ADRs keep sequential numbers.
 */
public class DatedIdStrategy implements IdStrategy {

    private final Clock clock;
    private final SequentialIdStrategy sequential = new SequentialIdStrategy();

    public DatedIdStrategy(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String nextId(ArtifactKind kind, GovernanceIndex index) {
        if (kind != ArtifactKind.WORK_ITEM) {
            return sequential.nextId(kind, index);
        }
        String dayPrefix = kind.prefix() + LocalDate.now(clock) + "-";
        Pattern pattern = Pattern.compile(Pattern.quote(dayPrefix) + "(\\d+)");
        int max = 0;
        for (String id : SequentialIdStrategy.knownIds(kind, index)) {
            Matcher m = pattern.matcher(id);
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return String.format("%s%03d", dayPrefix, max + 1);
    }
}
