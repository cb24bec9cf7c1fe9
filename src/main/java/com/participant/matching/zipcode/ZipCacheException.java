package com.participant.matching.zipcode;

/**
 * Thrown when the ZIP to county cache cannot be written.
 */
public class ZipCacheException extends RuntimeException {

    public ZipCacheException(String message) {
        super(message);
    }

    public ZipCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
