package com.tripdispatch.shared.enums;

public enum UserRole {
    REQUESTER,
    WORKER,
    SYSTEM
}
