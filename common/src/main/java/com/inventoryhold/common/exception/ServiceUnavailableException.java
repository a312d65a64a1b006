package com.inventoryhold.common.exception;

/**
 * The backing store failed (lock timeout, lost connection, commit failure) and the unit of work was
 * rolled back. The caller may retry the same request later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends BusinessException {

    public static final String ERROR_CODE = "SERVICE_UNAVAILABLE";

    public ServiceUnavailableException(String message) {
        super(message, ERROR_CODE);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
