package com.einvoicenews.collector.exception;

/**
 * Thrown from inside a source adapter. The orchestrator turns it into a failed, zero-item outcome.
 */
public class SourceAdapterException extends CollectorException {

    public SourceAdapterException(String sourceId, String message) {
        super("ADAPTER_ERROR", "[" + sourceId + "] " + message);
    }

    public SourceAdapterException(String sourceId, String message, Throwable cause) {
        super("ADAPTER_ERROR", "[" + sourceId + "] " + message, cause);
    }
}
