package com.einvoicenews.collector.exception;

/**
 * The corpus store could not be read or written. The only failure that is fatal to a run.
 */
public class CorpusStoreException extends CollectorException {

    private final String location;

    public CorpusStoreException(String message, String location, Throwable cause) {
        super("STORE_ERROR", message, cause);
        this.location = location;
    }

    public static CorpusStoreException readFailed(String location, Throwable cause) {
        return new CorpusStoreException("Failed to read corpus from " + location, location, cause);
    }

    public static CorpusStoreException writeFailed(String location, Throwable cause) {
        return new CorpusStoreException("Failed to write corpus to " + location, location, cause);
    }

    public String getLocation() {
        return location;
    }
}
