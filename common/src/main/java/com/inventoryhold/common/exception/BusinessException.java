package com.inventoryhold.common.exception;

import lombok.Getter;

/**
 * Caller-visible domain failure. The {@code errorCode} is what API clients branch on.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
