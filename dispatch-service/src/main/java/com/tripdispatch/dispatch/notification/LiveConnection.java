package com.tripdispatch.dispatch.notification;

import com.tripdispatch.shared.enums.UserRole;
import lombok.Getter;

import java.time.Instant;

@Getter
public class LiveConnection {

    private final String connectionId;
    private final String userId;
    private final UserRole role;
    private final Instant connectedAt;
    private final EventSink sink;

    private volatile boolean connected = true;
    private volatile Instant lastActivityAt;
    private volatile Instant disconnectedAt;

    LiveConnection(String connectionId, String userId, UserRole role, EventSink sink, Instant now) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.role = role;
        this.sink = sink;
        this.connectedAt = now;
        this.lastActivityAt = now;
    }

    void touch(Instant now) {
        this.lastActivityAt = now;
    }

    void markDisconnected(Instant now) {
        this.connected = false;
        this.disconnectedAt = now;
    }
}
