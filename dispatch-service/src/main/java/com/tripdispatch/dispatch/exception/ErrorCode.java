package com.tripdispatch.dispatch.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable failure codes returned to clients. The names are part of the API.
 */
public enum ErrorCode {
    INSUFFICIENT_BALANCE(HttpStatus.PAYMENT_REQUIRED),
    ACTIVE_TRIP_EXISTS(HttpStatus.CONFLICT),
    NO_MATCH_FOUND(HttpStatus.CONFLICT),
    OFFER_EXPIRED(HttpStatus.CONFLICT),
    ALREADY_ASSIGNED(HttpStatus.CONFLICT),
    INELIGIBLE_WORKER(HttpStatus.FORBIDDEN),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    STORE_CONFLICT(HttpStatus.CONFLICT),
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    TRIP_NOT_FOUND(HttpStatus.NOT_FOUND),
    NOT_TRIP_PARTICIPANT(HttpStatus.FORBIDDEN),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    SHARE_TOKEN_INVALID(HttpStatus.NOT_FOUND),
    TIP_REJECTED(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
