package com.einvoicenews.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    SUCCESS("success"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unrecognised values map to UNKNOWN so an older file never blocks a run.
     */
    @JsonCreator
    public static RunStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (RunStatus status : RunStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
