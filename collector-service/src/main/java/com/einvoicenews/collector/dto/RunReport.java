package com.einvoicenews.collector.dto;

import com.einvoicenews.collector.entity.RunStatus;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a collection run, used for the closing log lines and the process exit code.
 */
public record RunReport(
        RunStatus status,
        int newItems,
        int totalItems,
        List<AdapterOutcome> outcomes,
        Duration elapsed,
        String failureMessage
) {

    public RunReport {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static RunReport success(int newItems, int totalItems, List<AdapterOutcome> outcomes, Duration elapsed) {
        return new RunReport(RunStatus.SUCCESS, newItems, totalItems, outcomes, elapsed, null);
    }

    public static RunReport failed(int newItems, int totalItems, List<AdapterOutcome> outcomes,
                                   Duration elapsed, String failureMessage) {
        return new RunReport(RunStatus.FAILED, newItems, totalItems, outcomes, elapsed, failureMessage);
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }
}
