package com.logsentinel.core.exception;

/**
 * A compare-and-set write lost the race against a concurrent writer of the same
 * signature too many times in a row.
 *
 * <p>
 * Individual conflicts are retried transparently inside the store; this
 * exception only appears as the cause of the {@link StoreUnavailableException}
 * raised when the bounded conflict retries are exhausted.
 * </p>
 *
 * @since 1.0.0
 */
public class StoreConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String signatureKey;
    private final int attempts;

    public StoreConflictException(String signatureKey, int attempts) {
        super("Concurrent update conflict on '" + signatureKey + "' after " + attempts + " attempt(s)");
        this.signatureKey = signatureKey;
        this.attempts = attempts;
    }

    public String getSignatureKey() {
        return signatureKey;
    }

    public int getAttempts() {
        return attempts;
    }
}
