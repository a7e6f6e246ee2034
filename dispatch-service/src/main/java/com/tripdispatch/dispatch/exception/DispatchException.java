package com.tripdispatch.dispatch.exception;

public class DispatchException extends RuntimeException {

    private final ErrorCode errorCode;

    public DispatchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }
}
