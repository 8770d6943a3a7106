package com.charter.core.validation;

import com.charter.core.model.AdrStatus;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.WorkItemStatus;

/**
 * Transition graphs for every governed lifecycle. Edges only point forward.
 */
public final class LifecycleRules {

    public static final TransitionTable<RfcStatus> RFC_STATUS = TransitionTable.of(RfcStatus.class)
            .allow(RfcStatus.DRAFT, RfcStatus.NORMATIVE)
            .allow(RfcStatus.NORMATIVE, RfcStatus.DEPRECATED)
            .build();

    public static final TransitionTable<RfcPhase> RFC_PHASE = TransitionTable.of(RfcPhase.class)
            .allow(RfcPhase.SPEC, RfcPhase.IMPL)
            .allow(RfcPhase.IMPL, RfcPhase.TEST)
            .allow(RfcPhase.TEST, RfcPhase.STABLE)
            .build();

    public static final TransitionTable<AdrStatus> ADR_STATUS = TransitionTable.of(AdrStatus.class)
            .allow(AdrStatus.PROPOSED, AdrStatus.ACCEPTED, AdrStatus.REJECTED)
            .allow(AdrStatus.ACCEPTED, AdrStatus.SUPERSEDED)
            .build();

    public static final TransitionTable<ClauseStatus> CLAUSE_STATUS = TransitionTable.of(ClauseStatus.class)
            .allow(ClauseStatus.ACTIVE, ClauseStatus.SUPERSEDED, ClauseStatus.DEPRECATED)
            .build();

    public static final TransitionTable<WorkItemStatus> WORK_ITEM_STATUS = TransitionTable.of(WorkItemStatus.class)
            .allow(WorkItemStatus.QUEUE, WorkItemStatus.ACTIVE, WorkItemStatus.CANCELLED)
            .allow(WorkItemStatus.ACTIVE, WorkItemStatus.DONE, WorkItemStatus.CANCELLED)
            .build();

    private LifecycleRules() {}
}
