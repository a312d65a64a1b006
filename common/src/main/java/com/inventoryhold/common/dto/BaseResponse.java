package com.inventoryhold.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryhold.common.logging.RequestIdFilter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

import java.time.Instant;

/**
 * Envelope for every response of the reservation API.
 *
 * Every response carries the trace id of the request that produced it, so a saga step logged by the
 * orchestrator can be matched with this service's log lines. Errors add a machine-readable
 * {@code errorCode} that callers branch on.
 *
 * @param <T> Type of the response data
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private String errorCode;
    private String traceId;
    private Instant timestamp;

    public static <T> BaseResponse<T> success(T data) {
        return envelope(true, null, data, null);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return envelope(true, message, data, null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode) {
        return envelope(false, message, null, errorCode);
    }

    private static <T> BaseResponse<T> envelope(boolean success, String message, T data, String errorCode) {
        return new BaseResponse<>(success, message, data, errorCode,
                MDC.get(RequestIdFilter.MDC_TRACE_ID), Instant.now());
    }
}
