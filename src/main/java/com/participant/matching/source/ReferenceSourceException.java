package com.participant.matching.source;

/**
 * Thrown when the reference store cannot be reached or read.
 * Fatal for a matching run: a partially loaded index would silently lower match quality.
 */
public class ReferenceSourceException extends RuntimeException {

    public ReferenceSourceException(String message) {
        super(message);
    }

    public ReferenceSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
