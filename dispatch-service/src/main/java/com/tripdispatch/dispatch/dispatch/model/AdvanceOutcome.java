package com.tripdispatch.dispatch.dispatch.model;

public enum AdvanceOutcome {
    /** Trip is not searching; nothing to do. */
    IDLE,
    /** A batch is still open. */
    AWAITING_RESPONSES,
    BATCH_ISSUED,
    /** Another process claimed the batch first. */
    CONTENDED,
    EXHAUSTED
}
