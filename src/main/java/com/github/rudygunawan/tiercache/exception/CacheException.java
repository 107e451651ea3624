package com.github.rudygunawan.tiercache.exception;

/**
 * Base class for failures of a single cache call. The cache itself stays usable after one of
 * these is thrown.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
