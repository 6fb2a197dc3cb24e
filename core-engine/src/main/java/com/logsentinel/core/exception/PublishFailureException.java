package com.logsentinel.core.exception;

/**
 * The notification channel did not acknowledge a hand-off.
 *
 * <p>
 * {@link #isRetryable()} separates transient outages (retried with backoff)
 * from permanent rejections (surfaced as undelivered immediately).
 * </p>
 *
 * @since 1.0.0
 */
public class PublishFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    public PublishFailureException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PublishFailureException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static PublishFailureException transientFailure(String message, Throwable cause) {
        return new PublishFailureException(message, true, cause);
    }

    public static PublishFailureException permanentFailure(String message) {
        return new PublishFailureException(message, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
