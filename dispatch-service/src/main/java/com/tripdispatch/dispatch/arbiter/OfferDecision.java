package com.tripdispatch.dispatch.arbiter;

public enum OfferDecision {
    ACCEPT,
    DECLINE
}
