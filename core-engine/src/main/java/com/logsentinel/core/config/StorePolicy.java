package com.logsentinel.core.config;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Signature store settings: backend selection, retention and concurrency
 * bounds.
 *
 * <p>
 * Supported backends:
 * </p>
 * <ul>
 * <li>{@code memory}: process-local, for tests and single-node trials</li>
 * <li>{@code file}: one JSON document per signature under
 * {@code directory}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StorePolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Upper bound for {@link #lockTimeoutMillis}; store access stays in single-digit seconds. */
    static final long MAX_LOCK_TIMEOUT_MILLIS = 9_999;

    private String type = "memory";

    private String directory;

    /** Number of hourly buckets retained per signature. */
    private int retentionHours = 48;

    /** How long processed events and publication claims are remembered. */
    private int dedupWindowHours = 1;

    /** Read-merge-write cycles attempted before giving up on a contended key. */
    private int maxConflictRetries = 10;

    /** Bound on waiting for a per-signature write lock. */
    private long lockTimeoutMillis = 2_000;

    /**
     * How long a pending publication claim blocks other publishers. A claim
     * older than this was taken by an attempt that never confirmed it and may be
     * taken over.
     */
    private long claimLeaseMillis = 30_000;

    void collectErrors(List<String> errors) {
        if (type == null || type.isBlank()) {
            errors.add("store.type is required");
        } else {
            switch (type) {
                case "memory" -> {
                }
                case "file" -> {
                    if (directory == null || directory.isBlank()) {
                        errors.add("store.directory is required for store.type 'file'");
                    }
                }
                default -> errors.add("Unknown store.type: '" + type + "'. Supported: memory, file");
            }
        }
        if (retentionHours < 1) {
            errors.add("store.retentionHours must be >= 1, got: " + retentionHours);
        }
        if (dedupWindowHours < 1) {
            errors.add("store.dedupWindowHours must be >= 1, got: " + dedupWindowHours);
        }
        if (maxConflictRetries < 1) {
            errors.add("store.maxConflictRetries must be >= 1, got: " + maxConflictRetries);
        }
        if (lockTimeoutMillis < 1 || lockTimeoutMillis > MAX_LOCK_TIMEOUT_MILLIS) {
            errors.add("store.lockTimeoutMillis must be in [1, " + MAX_LOCK_TIMEOUT_MILLIS
                    + "], got: " + lockTimeoutMillis);
        }
        if (claimLeaseMillis < 1 || (dedupWindowHours >= 1 && claimLeaseMillis >= dedupWindowHours * 3_600_000L)) {
            errors.add("store.claimLeaseMillis must be >= 1 and shorter than the dedup window, got: "
                    + claimLeaseMillis);
        }
    }

    public String getType() {
        return type;
    }

    /**
     * Set the backend type, normalised to lowercase.
     *
     * @param type backend name
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(int retentionHours) {
        this.retentionHours = retentionHours;
    }

    public int getDedupWindowHours() {
        return dedupWindowHours;
    }

    public void setDedupWindowHours(int dedupWindowHours) {
        this.dedupWindowHours = dedupWindowHours;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public void setMaxConflictRetries(int maxConflictRetries) {
        this.maxConflictRetries = maxConflictRetries;
    }

    public long getLockTimeoutMillis() {
        return lockTimeoutMillis;
    }

    public void setLockTimeoutMillis(long lockTimeoutMillis) {
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    public long getClaimLeaseMillis() {
        return claimLeaseMillis;
    }

    public void setClaimLeaseMillis(long claimLeaseMillis) {
        this.claimLeaseMillis = claimLeaseMillis;
    }

    @Override
    public String toString() {
        return "StorePolicy{" +
                "type='" + type + '\'' +
                ", directory='" + directory + '\'' +
                ", retentionHours=" + retentionHours +
                ", dedupWindowHours=" + dedupWindowHours +
                ", maxConflictRetries=" + maxConflictRetries +
                ", lockTimeoutMillis=" + lockTimeoutMillis +
                ", claimLeaseMillis=" + claimLeaseMillis +
                '}';
    }
}
