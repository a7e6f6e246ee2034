package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.shared.enums.UserRole;

final class Callers {

    private Callers() {}

    static void requireRole(UserRole actual, UserRole expected) {
        if (actual != expected) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "This operation requires the " + expected + " role");
        }
    }
}
