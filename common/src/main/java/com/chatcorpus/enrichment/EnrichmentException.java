package com.chatcorpus.enrichment;

import lombok.Getter;

/**
 * A provider call that did not produce an enrichment.  Recoverable: the orchestrator
 * records it against the message and moves on.
 */
@Getter
public class EnrichmentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** HTTP status of the last attempt, or {@code -1} when no response was received. */
    private final int statusCode;

    public EnrichmentException(String message) {
        this(message, -1, null);
    }

    public EnrichmentException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public EnrichmentException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
