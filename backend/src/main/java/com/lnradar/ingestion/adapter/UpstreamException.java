package com.lnradar.ingestion.adapter;

/**
 * Thrown when an upstream wallet API call fails: non-2xx, timeout, or a body that cannot be decoded.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
