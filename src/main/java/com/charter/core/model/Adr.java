package com.charter.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Architectural decision record.
 *
 * @param id           identifier, e.g. {@code ADR-0003}
 * @param title        decision title
 * @param status       lifecycle status
 * @param date         date of the decision
 * @param context      forces at play
 * @param decision     what was decided
 * @param consequences resulting trade-offs
 * @param alternatives options weighed
 * @param refs         ids of related artifacts
 * @param supersededBy id of the ADR replacing this one
 */
public record Adr(
        String id,
        String title,
        AdrStatus status,
        LocalDate date,
        String context,
        String decision,
        String consequences,
        List<Alternative> alternatives,
        List<String> refs,
        String supersededBy
) {

    public Adr {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        refs = refs == null ? List.of() : List.copyOf(refs);
    }

    public Adr withStatus(AdrStatus newStatus) {
        return new Adr(id, title, newStatus, date, context, decision, consequences,
                alternatives, refs, supersededBy);
    }

    public Adr withSupersededBy(String adrId) {
        return new Adr(id, title, AdrStatus.SUPERSEDED, date, context, decision, consequences,
                alternatives, refs, adrId);
    }
}
