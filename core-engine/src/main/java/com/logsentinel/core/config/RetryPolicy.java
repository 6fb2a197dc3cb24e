package com.logsentinel.core.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded exponential-backoff settings, turned into a Resilience4j
 * {@link Retry} by {@link #toRetry(String, Predicate)}.
 *
 * @since 1.0.0
 */
public class RetryPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Total attempts, the first call included. */
    private int maxAttempts = 4;

    private long initialBackoffMillis = 100;

    private double backoffMultiplier = 2.0;

    private long maxBackoffMillis = 2_000;

    public RetryPolicy() {
    }

    public RetryPolicy(int maxAttempts, long initialBackoffMillis, double backoffMultiplier,
            long maxBackoffMillis) {
        this.maxAttempts = maxAttempts;
        this.initialBackoffMillis = initialBackoffMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.maxBackoffMillis = maxBackoffMillis;
    }

    void collectErrors(String section, List<String> errors) {
        if (maxAttempts < 1) {
            errors.add(section + ".maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoffMillis < 1) {
            errors.add(section + ".initialBackoffMillis must be >= 1, got: " + initialBackoffMillis);
        }
        if (backoffMultiplier < 1.0) {
            errors.add(section + ".backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
        }
        if (maxBackoffMillis < initialBackoffMillis) {
            errors.add(section + ".maxBackoffMillis must be >= initialBackoffMillis, got: "
                    + maxBackoffMillis);
        }
    }

    /**
     * Build a Resilience4j retry from this policy.
     *
     * @param name    retry instance name, used in logs
     * @param retryOn predicate selecting the exceptions worth retrying
     * @return a new retry instance
     */
    public Retry toRetry(String name, Predicate<Throwable> retryOn) {
        Objects.requireNonNull(retryOn, "retryOn predicate must not be null");
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        initialBackoffMillis, backoffMultiplier, maxBackoffMillis))
                .retryOnException(retryOn)
                .build();
        return Retry.of(name, config);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
        this.initialBackoffMillis = initialBackoffMillis;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public void setMaxBackoffMillis(long maxBackoffMillis) {
        this.maxBackoffMillis = maxBackoffMillis;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", initialBackoffMillis=" + initialBackoffMillis +
                ", backoffMultiplier=" + backoffMultiplier +
                ", maxBackoffMillis=" + maxBackoffMillis +
                '}';
    }
}
