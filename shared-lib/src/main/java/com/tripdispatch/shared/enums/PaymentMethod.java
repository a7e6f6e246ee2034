package com.tripdispatch.shared.enums;

public enum PaymentMethod {
    WALLET,
    CARD,
    CASH;

    public boolean requiresHold() {
        return this != CASH;
    }
}
