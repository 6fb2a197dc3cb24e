package com.logsentinel.core.store;

import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.ProcessedEvent;
import com.logsentinel.core.model.PublicationClaim;
import com.logsentinel.core.model.TimeBucket;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pure functions computing the next version of a {@link HistoryRecord}.
 *
 * <p>
 * Nothing here touches storage; {@link SignatureStore} calls these inside its
 * compare-and-set loop, so every method may run more than once for the same
 * input and must not have side effects.
 * </p>
 *
 * <h3>Buckets</h3>
 * <p>
 * Counts are aggregated into hourly buckets keyed by the UTC hour of the
 * event's own {@code observedAt}, so late or out-of-order events land in the
 * bucket they belong to. Only the most recent {@code retentionHours} bucket
 * slots up to the current hour, measured from the store clock, are retained.
 * An {@code observedAt} ahead of the store clock is counted in the current
 * hour's bucket.
 * </p>
 *
 * <h3>Publication claims</h3>
 * <p>
 * A pending claim blocks other publishers for {@code claimLease}; a confirmed
 * one for the whole dedup window.
 * </p>
 *
 * @since 1.0.0
 */
final class HistoryMerger {

    /** Minimum number of historical buckets for a defined baseline. */
    static final int MIN_BASELINE_BUCKETS = 2;

    private final int retentionHours;
    private final Duration dedupWindow;
    private final Duration claimLease;

    HistoryMerger(int retentionHours, Duration dedupWindow, Duration claimLease) {
        if (retentionHours < 1) {
            throw new IllegalArgumentException("retentionHours must be >= 1, got: " + retentionHours);
        }
        this.retentionHours = retentionHours;
        this.dedupWindow = dedupWindow;
        this.claimLease = claimLease;
    }

    static Instant bucketStart(Instant instant) {
        return instant.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * @return start of the oldest bucket slot still inside the retention
     *         horizon at {@code now}
     */
    Instant horizonStart(Instant now) {
        return bucketStart(now).minus(retentionHours - 1L, ChronoUnit.HOURS);
    }

    // ---------------------------------------------------------------
    // Merging
    // ---------------------------------------------------------------

    /**
     * Merge one event's count into {@code current}, or create the first version
     * when {@code current} is {@code null}.
     */
    HistoryRecord merge(HistoryRecord current, ErrorSignature signature, long count,
            Instant observedAt, Instant now) {
        Instant currentHour = bucketStart(now);
        Instant written = bucketStart(observedAt);
        if (written.isAfter(currentHour)) {
            written = currentHour;
        }

        TreeMap<Instant, Long> counts = new TreeMap<>();
        if (current != null) {
            for (TimeBucket bucket : current.getWindowBuckets()) {
                counts.put(bucket.getStart(), bucket.getCount());
            }
        }
        counts.merge(written, count, Math::addExact);

        List<TimeBucket> retained = new ArrayList<>();
        Map<Instant, Long> window = counts.subMap(horizonStart(now), true, currentHour, true);
        for (Map.Entry<Instant, Long> entry : window.entrySet()) {
            retained.add(new TimeBucket(entry.getKey(), entry.getValue()));
        }

        List<ProcessedEvent> ledger = current != null ? liveEvents(current, now) : new ArrayList<>();
        ledger.add(new ProcessedEvent(observedAt, count, now, null));

        HistoryRecord.Builder next = current != null
                ? current.toBuilder()
                        .version(current.getVersion() + 1)
                        .totalOccurrences(Math.addExact(current.getTotalOccurrences(), count))
                        .publications(liveClaims(current, now))
                : HistoryRecord.builder()
                        .signature(signature)
                        .version(1)
                        .totalOccurrences(count)
                        .createdAt(now);

        return next.windowBuckets(retained)
                .baselineRate(baseline(retained, written))
                .recentEvents(ledger)
                .updatedAt(now)
                .build();
    }

    /**
     * Stamp an alert onto a freshly merged record: {@code lastAlertAt} moves to
     * {@code now} and the event's ledger entry remembers the reason. Does not
     * bump the version; the merged record has not been written yet.
     */
    HistoryRecord markAlerted(HistoryRecord merged, Instant observedAt, long count,
            AlertReason reason, Instant now) {
        List<ProcessedEvent> ledger = new ArrayList<>();
        for (ProcessedEvent event : merged.getRecentEvents()) {
            ledger.add(event.matches(observedAt, count) ? event.withReason(reason) : event);
        }
        return merged.toBuilder()
                .lastAlertAt(now)
                .recentEvents(ledger)
                .build();
    }

    static Double baseline(List<TimeBucket> buckets, Instant excluded) {
        long sum = 0;
        int n = 0;
        for (TimeBucket bucket : buckets) {
            if (!bucket.getStart().equals(excluded)) {
                sum += bucket.getCount();
                n++;
            }
        }
        return n < MIN_BASELINE_BUCKETS ? null : (double) sum / n;
    }

    // ---------------------------------------------------------------
    // Dedup ledgers
    // ---------------------------------------------------------------

    Optional<ProcessedEvent> findLiveProcessed(HistoryRecord record, Instant observedAt, long count,
            Instant now) {
        return record.findProcessed(observedAt, count)
                .filter(event -> isLive(event.getProcessedAt(), now));
    }

    /**
     * @return whether a confirmed claim, or a pending one still within its
     *         lease, exists for {@code observedAt}
     */
    boolean hasLiveClaim(HistoryRecord record, Instant observedAt, Instant now) {
        return record.getPublications().stream()
                .filter(claim -> claim.getObservedAt().equals(observedAt))
                .filter(claim -> isLive(claim.getClaimedAt(), now))
                .anyMatch(claim -> claim.isConfirmed() || claim.getClaimedAt().isAfter(now.minus(claimLease)));
    }

    /** Add a pending claim, replacing an abandoned one for the same {@code observedAt}. */
    HistoryRecord addClaim(HistoryRecord record, Instant observedAt, Instant now) {
        List<PublicationClaim> claims = liveClaims(record, now);
        claims.removeIf(claim -> claim.getObservedAt().equals(observedAt));
        claims.add(new PublicationClaim(observedAt, now));
        return record.toBuilder()
                .version(record.getVersion() + 1)
                .publications(claims)
                .recentEvents(liveEvents(record, now))
                .updatedAt(now)
                .build();
    }

    /** Mark the claim for {@code observedAt} acknowledged, recreating it if it already expired. */
    HistoryRecord confirmClaim(HistoryRecord record, Instant observedAt, Instant now) {
        List<PublicationClaim> claims = new ArrayList<>();
        boolean found = false;
        for (PublicationClaim claim : liveClaims(record, now)) {
            if (claim.getObservedAt().equals(observedAt)) {
                claims.add(claim.confirm(now));
                found = true;
            } else {
                claims.add(claim);
            }
        }
        if (!found) {
            claims.add(new PublicationClaim(observedAt, now, now));
        }
        return record.toBuilder()
                .version(record.getVersion() + 1)
                .publications(claims)
                .updatedAt(now)
                .build();
    }

    HistoryRecord removeClaim(HistoryRecord record, Instant observedAt, Instant now) {
        List<PublicationClaim> claims = liveClaims(record, now);
        claims.removeIf(claim -> claim.getObservedAt().equals(observedAt));
        return record.toBuilder()
                .version(record.getVersion() + 1)
                .publications(claims)
                .updatedAt(now)
                .build();
    }

    private boolean isLive(Instant stamp, Instant now) {
        return stamp.isAfter(now.minus(dedupWindow));
    }

    private List<ProcessedEvent> liveEvents(HistoryRecord record, Instant now) {
        List<ProcessedEvent> live = new ArrayList<>();
        for (ProcessedEvent event : record.getRecentEvents()) {
            if (isLive(event.getProcessedAt(), now)) {
                live.add(event);
            }
        }
        return live;
    }

    private List<PublicationClaim> liveClaims(HistoryRecord record, Instant now) {
        List<PublicationClaim> live = new ArrayList<>();
        for (PublicationClaim claim : record.getPublications()) {
            if (isLive(claim.getClaimedAt(), now)) {
                live.add(claim);
            }
        }
        return live;
    }
}
