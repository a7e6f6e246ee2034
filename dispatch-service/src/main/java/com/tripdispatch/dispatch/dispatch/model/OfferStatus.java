package com.tripdispatch.dispatch.dispatch.model;

public enum OfferStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    EXPIRED,
    CANCELLED
}
