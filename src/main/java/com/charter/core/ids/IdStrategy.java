package com.charter.core.ids;

import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;

/**
 * Allocates the id of a new RFC, ADR or work item.
 * Ids of deleted artifacts are never handed out again.
 */
public interface IdStrategy {

    /**
     * @param kind  the kind being created; {@link ArtifactKind#CLAUSE} ids are chosen by authors
     * @param index current store snapshot
     * @return a fresh id not used by any artifact or tombstone
     */
    String nextId(ArtifactKind kind, GovernanceIndex index);
}
