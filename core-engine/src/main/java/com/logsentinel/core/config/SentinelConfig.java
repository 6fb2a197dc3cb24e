package com.logsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the {@code sentinel.yml} configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * filter:
 *   spikeFactor: 3.0
 *   absoluteMinThreshold: 10
 * store:
 *   type: file
 *   directory: /var/lib/log-sentinel
 *   retentionHours: 48
 * retry:
 *   maxAttempts: 4
 * publisher:
 *   maxAttempts: 3
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private FilterPolicy filter = new FilterPolicy();

    private StorePolicy store = new StorePolicy();

    /** Backoff for signature store access from the anomaly filter. */
    private RetryPolicy retry = new RetryPolicy();

    /** Backoff for hand-offs to the notification channel. */
    private RetryPolicy publisher = new RetryPolicy(3, 200, 2.0, 5_000);

    /**
     * Validate every section, collecting all errors before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        filter.collectErrors(errors);
        store.collectErrors(errors);
        retry.collectErrors("retry", errors);
        publisher.collectErrors("publisher", errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public FilterPolicy getFilter() {
        return filter;
    }

    public void setFilter(FilterPolicy filter) {
        this.filter = filter != null ? filter : new FilterPolicy();
    }

    public StorePolicy getStore() {
        return store;
    }

    public void setStore(StorePolicy store) {
        this.store = store != null ? store : new StorePolicy();
    }

    public RetryPolicy getRetry() {
        return retry;
    }

    public void setRetry(RetryPolicy retry) {
        this.retry = retry != null ? retry : new RetryPolicy();
    }

    public RetryPolicy getPublisher() {
        return publisher;
    }

    public void setPublisher(RetryPolicy publisher) {
        this.publisher = publisher != null ? publisher : new RetryPolicy(3, 200, 2.0, 5_000);
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "filter=" + filter +
                ", store=" + store +
                ", retry=" + retry +
                ", publisher=" + publisher +
                '}';
    }
}
