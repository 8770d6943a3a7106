package com.charter.core.validation;

import com.charter.core.model.Clause;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcStatus;

import java.util.Optional;

/**
 * Whether RFC content may still change, checked separately from the lifecycle
 * transitions.
 * <p>
 * The content of an RFC and its clauses stays editable until the RFC is deprecated;
 * a clause additionally has to be active. Editing a normative RFC amends it: its
 * signature drifts from the one recorded at the last version bump until the next
 * bump records a new version.
 */
public final class AmendmentPolicy {

    private AmendmentPolicy() {}

    /** @return why the RFC's own fields are locked, or empty when they may be edited */
    public static Optional<String> rfcLock(Rfc rfc) {
        if (rfc.status() == RfcStatus.DEPRECATED) {
            return Optional.of(rfc.id() + " is deprecated and can no longer be amended");
        }
        return Optional.empty();
    }

    /** @return why the clause is locked, or empty when it may be edited */
    public static Optional<String> clauseLock(Rfc rfc, Clause clause) {
        Optional<String> rfcLock = rfcLock(rfc);
        if (rfcLock.isPresent()) {
            return rfcLock;
        }
        if (!clause.status().isActive()) {
            return Optional.of(rfc.id() + ":" + clause.id() + " is " + clause.status() + " and can no longer be edited");
        }
        return Optional.empty();
    }

    /**
     * A normative RFC whose content no longer matches what was recorded at its last
     * release carries unreleased amendments. Status and phase moves are not content.
     *
     * @param contentSignature the RFC's current content signature
     */
    public static boolean isAmended(Rfc rfc, String contentSignature) {
        return rfc.status() == RfcStatus.NORMATIVE
                && rfc.releasedSignature() != null
                && !rfc.releasedSignature().equals(contentSignature);
    }
}
