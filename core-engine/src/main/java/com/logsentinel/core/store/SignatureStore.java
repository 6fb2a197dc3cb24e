package com.logsentinel.core.store;

import com.logsentinel.core.config.StorePolicy;
import com.logsentinel.core.exception.StoreConflictException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.ProcessedEvent;
import com.logsentinel.core.model.TimeBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Concurrency-safe store of one {@link HistoryRecord} per
 * {@link ErrorSignature}.
 *
 * <h3>Update discipline</h3>
 * <p>
 * Every mutation is an optimistic read-merge-write cycle: read the current
 * record and its version, compute the next record, then
 * {@link RecordStore#compareAndSet compare-and-set} it. A lost race re-reads
 * and recomputes, so concurrent merges for one signature accumulate instead of
 * overwriting each other. After {@code maxConflictRetries} lost races the call
 * fails with {@link StoreUnavailableException} caused by
 * {@link StoreConflictException}. Different signatures never contend.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Nothing is cached between calls; each cycle starts from a fresh read.
 * </p>
 *
 * @since 1.0.0
 */
public class SignatureStore {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureStore.class);

    private final RecordStore records;
    private final HistoryMerger merger;
    private final Clock clock;
    private final int maxConflictRetries;

    /**
     * @param records backend holding the records
     * @param policy  retention, dedup window and conflict bounds
     * @param clock   time source for bucket eviction and dedup expiry
     */
    public SignatureStore(RecordStore records, StorePolicy policy, Clock clock) {
        this.records = Objects.requireNonNull(records, "RecordStore must not be null");
        Objects.requireNonNull(policy, "StorePolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.merger = new HistoryMerger(policy.getRetentionHours(),
                Duration.ofHours(policy.getDedupWindowHours()),
                Duration.ofMillis(policy.getClaimLeaseMillis()));
        if (policy.getMaxConflictRetries() < 1) {
            throw new IllegalArgumentException(
                    "maxConflictRetries must be >= 1, got: " + policy.getMaxConflictRetries());
        }
        this.maxConflictRetries = policy.getMaxConflictRetries();
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @param signature the signature
     * @return the current record, or empty if the signature was never seen
     * @throws StoreUnavailableException on transient backend failure
     */
    public Optional<HistoryRecord> get(ErrorSignature signature) {
        Objects.requireNonNull(signature, "signature must not be null");
        return records.load(signature);
    }

    /**
     * Sum the bucket counts whose start lies within
     * {@code [now - lookbackHours, now]}.
     *
     * @param signature     the signature
     * @param lookbackHours lookback in hours; must be {@code >= 1}
     * @return occurrences in the lookback, {@code 0} for an unknown signature
     * @throws IllegalArgumentException  if {@code lookbackHours < 1}
     * @throws StoreUnavailableException on transient backend failure
     */
    public long queryOccurrences(ErrorSignature signature, int lookbackHours) {
        if (lookbackHours < 1) {
            throw new IllegalArgumentException("lookbackHours must be >= 1, got: " + lookbackHours);
        }
        return get(signature)
                .map(record -> sumWithin(record, lookbackHours, clock.instant()))
                .orElse(0L);
    }

    /**
     * Same window as {@link #queryOccurrences}, applied to a record already in
     * hand.
     *
     * @param record        the record; must not be {@code null}
     * @param lookbackHours lookback in hours
     * @return occurrences in the lookback
     */
    public long countWithin(HistoryRecord record, int lookbackHours) {
        Objects.requireNonNull(record, "record must not be null");
        return sumWithin(record, lookbackHours, clock.instant());
    }

    static long sumWithin(HistoryRecord record, int lookbackHours, Instant now) {
        Instant from = now.minus(lookbackHours, ChronoUnit.HOURS);
        long sum = 0;
        for (TimeBucket bucket : record.getWindowBuckets()) {
            Instant start = bucket.getStart();
            if (!start.isBefore(from) && !start.isAfter(now)) {
                sum += bucket.getCount();
            }
        }
        return sum;
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Merge {@code count} occurrences observed at {@code observedAt} into the
     * signature's history, creating it on first sighting.
     *
     * @return the record as persisted
     * @see #upsertAndMerge(ErrorSignature, long, Instant, AlertEvaluator)
     */
    public HistoryRecord upsertAndMerge(ErrorSignature signature, long count, Instant observedAt) {
        return upsertAndMerge(signature, count, observedAt, AlertEvaluator.NEVER).getCurrent();
    }

    /**
     * Atomically merge an event into the signature's history and let
     * {@code evaluator} decide, against the same state, whether it alerts. A
     * positive evaluation sets {@code lastAlertAt} in the same write, so two
     * concurrent events cannot both see the signature as not yet alerted.
     *
     * <p>
     * An event already merged within the dedup window (same
     * {@code observedAt} and {@code count}) is not merged again; the result is
     * flagged as a duplicate carrying the originally recorded reason.
     * </p>
     *
     * @param signature  the signature
     * @param count      occurrences to add; must be {@code > 0}
     * @param observedAt when the occurrences were observed
     * @param evaluator  alert decision callback
     * @return what was written and decided
     * @throws IllegalArgumentException  if {@code count <= 0}
     * @throws StoreUnavailableException on backend failure or exhausted
     *                                   conflict retries
     */
    public UpsertResult upsertAndMerge(ErrorSignature signature, long count, Instant observedAt,
            AlertEvaluator evaluator) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        Objects.requireNonNull(evaluator, "evaluator must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got: " + count);
        }

        return update(signature, current -> {
            Instant now = clock.instant();
            if (current != null) {
                Optional<ProcessedEvent> seen = merger.findLiveProcessed(current, observedAt, count, now);
                if (seen.isPresent()) {
                    return Mutation.none(UpsertResult.duplicate(current, seen.get().getReason()));
                }
            }
            HistoryRecord merged = merger.merge(current, signature, count, observedAt, now);
            AlertReason reason = evaluator.evaluate(current, merged, count, now).orElse(null);
            if (reason != null) {
                merged = merger.markAlerted(merged, observedAt, count, reason, now);
            }
            return Mutation.write(merged, UpsertResult.merged(current, merged, reason));
        });
    }

    /**
     * Claim the right to publish the alert for {@code (signature, observedAt)}.
     * The claim stays pending until {@link #confirmPublication} and can be
     * taken over once its lease has run out.
     *
     * @return {@code true} if this caller now holds the claim, {@code false} if
     *         a confirmed claim or a pending one within its lease exists
     * @throws IllegalStateException     if the signature has no history
     * @throws StoreUnavailableException on backend failure
     */
    public boolean claimPublication(ErrorSignature signature, Instant observedAt) {
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        return update(signature, current -> {
            if (current == null) {
                throw new IllegalStateException("No history for '" + signature.key()
                        + "'; a decision must be merged before it is published");
            }
            Instant now = clock.instant();
            if (merger.hasLiveClaim(current, observedAt, now)) {
                return Mutation.none(Boolean.FALSE);
            }
            return Mutation.write(merger.addClaim(current, observedAt, now), Boolean.TRUE);
        });
    }

    /**
     * Record that the channel acknowledged the alert for
     * {@code (signature, observedAt)}; redeliveries within the dedup window are
     * then swallowed.
     *
     * @throws StoreUnavailableException on backend failure
     */
    public void confirmPublication(ErrorSignature signature, Instant observedAt) {
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        update(signature, current -> {
            if (current == null) {
                throw new IllegalStateException("No history for '" + signature.key() + "'");
            }
            return Mutation.write(merger.confirmClaim(current, observedAt, clock.instant()), null);
        });
    }

    /**
     * Drop the publication claim for {@code (signature, observedAt)} so that a
     * redelivered event may publish again.
     *
     * @throws StoreUnavailableException on backend failure
     */
    public void releasePublication(ErrorSignature signature, Instant observedAt) {
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        update(signature, current -> {
            if (current == null || !current.isPublicationClaimed(observedAt)) {
                return Mutation.none(null);
            }
            return Mutation.write(merger.removeClaim(current, observedAt, clock.instant()), null);
        });
    }

    // ---------------------------------------------------------------
    // Compare-and-set loop
    // ---------------------------------------------------------------

    private <T> T update(ErrorSignature signature, Function<HistoryRecord, Mutation<T>> step) {
        Objects.requireNonNull(signature, "signature must not be null");
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            Optional<HistoryRecord> current = records.load(signature);
            Mutation<T> mutation = step.apply(current.orElse(null));
            if (mutation.replacement == null) {
                return mutation.result;
            }
            long expectedVersion = current.map(HistoryRecord::getVersion).orElse(0L);
            if (records.compareAndSet(signature, expectedVersion, mutation.replacement)) {
                return mutation.result;
            }
            LOG.debug("Write conflict on [{}] at version {} (attempt {}/{})",
                    signature.key(), expectedVersion, attempt, maxConflictRetries);
        }
        StoreConflictException conflict = new StoreConflictException(signature.key(), maxConflictRetries);
        LOG.warn("Giving up on [{}]: {}", signature.key(), conflict.getMessage());
        throw new StoreUnavailableException("Signature store contended: " + conflict.getMessage(), conflict);
    }

    /** Result of one cycle step: the record to write (or none) and the value to return. */
    private static final class Mutation<T> {
        private final HistoryRecord replacement;
        private final T result;

        private Mutation(HistoryRecord replacement, T result) {
            this.replacement = replacement;
            this.result = result;
        }

        static <T> Mutation<T> write(HistoryRecord replacement, T result) {
            return new Mutation<>(Objects.requireNonNull(replacement), result);
        }

        static <T> Mutation<T> none(T result) {
            return new Mutation<>(null, result);
        }
    }
}
