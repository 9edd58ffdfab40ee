package com.einvoicenews.collector.dto;

import com.einvoicenews.collector.exception.CollectorException;
import java.time.Duration;

/**
 * Per-source result of one collection run.
 */
public record AdapterOutcome(
        String sourceId,
        String sourceName,
        Status status,
        int itemsReturned,
        int itemsAccepted,
        int itemsRejected,
        String errorCode,
        String errorMessage,
        Duration elapsed
) {

    static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public static AdapterOutcome succeeded(String sourceId, String sourceName,
                                           int returned, int accepted, Duration elapsed) {
        return new AdapterOutcome(sourceId, sourceName, Status.SUCCEEDED,
                returned, accepted, returned - accepted, null, null, elapsed);
    }

    public static AdapterOutcome failed(String sourceId, String sourceName, Throwable error, Duration elapsed) {
        String message = error != null
                ? error.getClass().getSimpleName() + ": " + error.getMessage()
                : "unknown error";
        String code = error instanceof CollectorException collectorError
                ? collectorError.getErrorCode()
                : UNEXPECTED_ERROR;
        return new AdapterOutcome(sourceId, sourceName, Status.FAILED, 0, 0, 0, code, message, elapsed);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
