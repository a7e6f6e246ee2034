package com.tripdispatch.dispatch.scheduling;

public enum PromotionOutcome {
    PROMOTED,
    /** Requester is on another trip; retried on the next run. */
    DEFERRED,
    CANCELLED,
    SKIPPED
}
