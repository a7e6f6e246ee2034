package com.tripdispatch.dispatch.ledger.model;

public enum LedgerEntryStatus {
    COMPLETED,
    VOIDED
}
