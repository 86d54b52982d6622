package com.entity.blocking.exception;

/**
 * Runtime exception thrown when an index is queried in the wrong lifecycle phase:
 * before it was built, or after it was reset and not rebuilt.
 * Signals a caller sequencing bug and is never retried.
 */
public class IndexStateException extends RuntimeException {

    public IndexStateException(String message) {
        super(message);
    }

    public IndexStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
