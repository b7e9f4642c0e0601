package com.servicehealth.analytics.exception;

/**
 * Raised by the metrics store when a read or write cannot be completed.
 */
public class MetricsStoreException extends RuntimeException {

    public MetricsStoreException(String message) {
        super(message);
    }

    public MetricsStoreException(String message, Throwable cause) {
        super(message, cause);
    }

}
