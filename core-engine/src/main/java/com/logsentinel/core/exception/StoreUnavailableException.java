package com.logsentinel.core.exception;

/**
 * Transient failure of the signature store. Callers retry with backoff and,
 * once retries are exhausted, surface the event as failed so that upstream
 * redelivery can drive it again.
 *
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
