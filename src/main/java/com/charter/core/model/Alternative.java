package com.charter.core.model;

import java.util.List;

/**
 * An option weighed by an ADR.
 *
 * @param text            the option
 * @param status          considered, accepted or rejected
 * @param pros            arguments for
 * @param cons            arguments against
 * @param rejectionReason why it was rejected, if it was
 */
public record Alternative(
        String text,
        AlternativeStatus status,
        List<String> pros,
        List<String> cons,
        String rejectionReason
) {

    public Alternative {
        status = status == null ? AlternativeStatus.CONSIDERED : status;
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }

    public static Alternative considered(String text) {
        return new Alternative(text, AlternativeStatus.CONSIDERED, List.of(), List.of(), null);
    }
}
