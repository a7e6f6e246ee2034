package com.tripdispatch.dispatch.tracking;

import java.time.Instant;
import java.util.UUID;

public record ShareLink(UUID tripId, String token, Instant expiresAt) {

    static ShareLink of(ShareToken token) {
        return new ShareLink(token.getTripId(), token.getToken(), token.getExpiresAt());
    }
}
