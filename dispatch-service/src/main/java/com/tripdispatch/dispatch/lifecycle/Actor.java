package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.shared.enums.UserRole;

public record Actor(String id, UserRole role) {

    public static final Actor SYSTEM = new Actor("system", UserRole.SYSTEM);

    public static Actor requester(String id) {
        return new Actor(id, UserRole.REQUESTER);
    }

    public static Actor worker(String id) {
        return new Actor(id, UserRole.WORKER);
    }
}
