package com.smurthy.ai.tutor.cache;

/**
 * The cache could not be consulted or written. Always absorbed by the
 * supervisor: a failed lookup is a miss, a failed store is skipped.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
