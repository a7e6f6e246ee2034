package com.tripdispatch.dispatch.ledger.model;

import java.util.EnumSet;
import java.util.Set;

public enum LedgerEntryType {
    CREDIT,
    DEBIT,
    HOLD,
    REFUND;

    public static final Set<LedgerEntryType> INFLOWS = EnumSet.of(CREDIT, REFUND);
    public static final Set<LedgerEntryType> OUTFLOWS = EnumSet.of(DEBIT, HOLD);

    /** Entry types that settle a hold. */
    public static final Set<LedgerEntryType> SETTLEMENTS = EnumSet.of(DEBIT, REFUND);
}
