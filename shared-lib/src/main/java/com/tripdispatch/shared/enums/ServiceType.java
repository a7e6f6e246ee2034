package com.tripdispatch.shared.enums;

public enum ServiceType {
    RIDE,
    DELIVERY
}
