package com.tripdispatch.shared.context;

/**
 * Header names carrying the caller identity verified by the edge layer.
 * Services trust these values and never re-verify credentials.
 */
public final class IdentityHeaders {

    public static final String USER_ID         = "X-User-Id";
    public static final String USER_ROLE       = "X-User-Role";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private IdentityHeaders() {}
}
