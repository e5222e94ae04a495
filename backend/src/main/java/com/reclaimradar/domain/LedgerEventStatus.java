package com.reclaimradar.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a ledger event. WAITING, CLAIMABLE and RESOLVED are computed; the rest are set by an operator.
 */
public enum LedgerEventStatus {
    WAITING,
    CLAIMABLE,
    CLAIM_INITIATED,
    CLAIMED,
    PAID,
    INVALID,
    RESOLVED;

    private static final Set<LedgerEventStatus> OPERATOR_OWNED = EnumSet.of(CLAIM_INITIATED, CLAIMED, PAID, INVALID);

    /** True when only an explicit operator action may move the event out of this status. */
    public boolean isOperatorOwned() {
        return OPERATOR_OWNED.contains(this);
    }
}
