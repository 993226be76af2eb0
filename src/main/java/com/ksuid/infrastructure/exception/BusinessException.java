package com.ksuid.infrastructure.exception;

/**
 * Base type for exceptions that carry a stable error code.
 * Used where an expected failure has to cross an API that cannot return a Result.
 */
public abstract class BusinessException extends RuntimeException {

    private final String errorCode;

    protected BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
