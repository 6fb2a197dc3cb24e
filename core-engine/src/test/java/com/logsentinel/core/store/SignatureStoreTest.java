package com.logsentinel.core.store;

import com.logsentinel.core.MutableClock;
import com.logsentinel.core.config.StorePolicy;
import com.logsentinel.core.exception.StoreConflictException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.LogLevel;
import com.logsentinel.core.model.TimeBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignatureStore} over the in-memory backend.
 */
class SignatureStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:20:00Z");
    private static final ErrorSignature NPE = ErrorSignature.of(LogLevel.ERROR, "NullPointerException");

    private MutableClock clock;
    private StorePolicy policy;
    private InMemoryRecordStore records;
    private SignatureStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        policy = new StorePolicy();
        policy.setRetentionHours(48);
        policy.setMaxConflictRetries(10_000);
        records = new InMemoryRecordStore();
        store = new SignatureStore(records, policy, clock);
    }

    @Test
    @DisplayName("First upsert should create a record with a single bucket")
    void shouldCreateRecordOnFirstSighting() {
        assertThat(store.get(NPE)).isEmpty();

        HistoryRecord record = store.upsertAndMerge(NPE, 5, T0);

        assertThat(record.getVersion()).isEqualTo(1);
        assertThat(record.getTotalOccurrences()).isEqualTo(5);
        assertThat(record.getWindowBuckets())
                .containsExactly(new TimeBucket(Instant.parse("2024-03-01T10:00:00Z"), 5));
        assertThat(record.getBaselineRate()).isNull();
        assertThat(record.getCreatedAt()).isEqualTo(T0);
        assertThat(store.get(NPE)).contains(record);
    }

    @Test
    @DisplayName("Events in the same hour should merge into one bucket")
    void shouldMergeSameHour() {
        store.upsertAndMerge(NPE, 5, T0);
        HistoryRecord record = store.upsertAndMerge(NPE, 3, T0.plus(Duration.ofMinutes(30)));

        assertThat(record.getWindowBuckets()).hasSize(1);
        assertThat(record.getWindowBuckets().get(0).getCount()).isEqualTo(8);
        assertThat(record.getTotalOccurrences()).isEqualTo(8);
        assertThat(record.getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("Baseline should average the retained buckets excluding the one just written")
    void shouldComputeBaselineExcludingWrittenBucket() {
        store.upsertAndMerge(NPE, 2, T0.minus(Duration.ofHours(3)));
        HistoryRecord two = store.upsertAndMerge(NPE, 4, T0.minus(Duration.ofHours(2)));
        assertThat(two.getBaselineRate()).as("one historical bucket is not enough").isNull();

        HistoryRecord three = store.upsertAndMerge(NPE, 100, T0);

        assertThat(three.getBaselineRate()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Late events should land in the bucket of their own observedAt")
    void shouldMergeOutOfOrderEvents() {
        store.upsertAndMerge(NPE, 5, T0);
        HistoryRecord record = store.upsertAndMerge(NPE, 2, T0.minus(Duration.ofHours(5)));

        assertThat(record.getWindowBuckets()).extracting(TimeBucket::getStart).containsExactly(
                Instant.parse("2024-03-01T05:00:00Z"), Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(record.getTotalOccurrences()).isEqualTo(7);
    }

    @Test
    @DisplayName("Buckets older than the retention horizon should be evicted while the total keeps growing")
    void shouldEvictOldBuckets() {
        store.upsertAndMerge(NPE, 5, T0);
        long before = store.get(NPE).orElseThrow().getTotalOccurrences();

        clock.advance(Duration.ofHours(49));
        HistoryRecord record = store.upsertAndMerge(NPE, 1, clock.instant());

        assertThat(record.getWindowBuckets()).hasSize(1);
        assertThat(record.getWindowBuckets().get(0).getCount()).isEqualTo(1);
        assertThat(record.getTotalOccurrences()).isEqualTo(before + 1);
        assertThat(store.queryOccurrences(NPE, 72)).isEqualTo(1);
    }

    @Test
    @DisplayName("A first sighting older than the horizon should create a record with its total but no bucket")
    void shouldNotKeepBucketsBeyondHorizon() {
        HistoryRecord record = store.upsertAndMerge(NPE, 4, T0.minus(Duration.ofHours(60)));

        assertThat(record.getWindowBuckets()).isEmpty();
        assertThat(record.getTotalOccurrences()).isEqualTo(4);
    }

    @Test
    @DisplayName("Future-dated events should land in the current hour and never widen the retained window")
    void shouldNotRetainFutureBuckets() {
        policy.setRetentionHours(3);
        store = new SignatureStore(records, policy, clock);
        store.upsertAndMerge(NPE, 1, T0.minus(Duration.ofHours(2)));
        store.upsertAndMerge(NPE, 1, T0.minus(Duration.ofHours(1)));

        HistoryRecord record = null;
        for (int h = 0; h <= 9; h++) {
            record = store.upsertAndMerge(NPE, 1, T0.plus(Duration.ofHours(h)));
        }

        assertThat(record.getWindowBuckets()).hasSize(3);
        assertThat(record.getWindowBuckets()).extracting(TimeBucket::getStart).containsExactly(
                Instant.parse("2024-03-01T08:00:00Z"), Instant.parse("2024-03-01T09:00:00Z"),
                Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(record.getWindowBuckets().get(2).getCount()).isEqualTo(10);
        assertThat(record.getBaselineRate()).as("only past hours feed the baseline").isEqualTo(1.0);
        assertThat(record.getTotalOccurrences()).isEqualTo(12);
        assertThat(store.queryOccurrences(NPE, 24)).isEqualTo(12);
    }

    @Test
    @DisplayName("Total should never decrease across a sequence of upserts")
    void shouldBeMonotonic() {
        long previous = 0;
        for (int i = 0; i < 60; i++) {
            clock.advance(Duration.ofMinutes(37));
            HistoryRecord record = store.upsertAndMerge(NPE, 1 + (i % 4), clock.instant());
            assertThat(record.getTotalOccurrences()).isGreaterThan(previous);
            previous = record.getTotalOccurrences();
        }
    }

    @Test
    @DisplayName("Query should sum buckets starting within the lookback and answer 0 for unknown signatures")
    void shouldQueryWithinLookback() {
        store.upsertAndMerge(NPE, 5, T0.minus(Duration.ofHours(30)));
        store.upsertAndMerge(NPE, 8, T0.minus(Duration.ofHours(2)));
        store.upsertAndMerge(NPE, 3, T0);

        assertThat(store.queryOccurrences(NPE, 24)).isEqualTo(11);
        assertThat(store.queryOccurrences(NPE, 48)).isEqualTo(16);
        assertThat(store.queryOccurrences(ErrorSignature.of(LogLevel.INFO, "never seen"), 24)).isZero();
        assertThatThrownBy(() -> store.queryOccurrences(NPE, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject non-positive counts")
    void shouldRejectZeroCount() {
        assertThatThrownBy(() -> store.upsertAndMerge(NPE, 0, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.get(NPE)).isEmpty();
    }

    @Test
    @DisplayName("N concurrent upserts should add exactly the sum of their counts")
    void shouldNotLoseConcurrentUpdates() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicLong expected = new AtomicLong();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        long count = 1 + (i % 3);
                        expected.addAndGet(count);
                        Instant observedAt = T0.plusMillis(thread * 1_000L + i);
                        store.upsertAndMerge(NPE, count, observedAt);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        HistoryRecord record = store.get(NPE).orElseThrow();
        assertThat(record.getTotalOccurrences()).isEqualTo(expected.get());
        assertThat(record.getVersion()).isEqualTo(threads * perThread);
        assertThat(store.queryOccurrences(NPE, 1)).isEqualTo(expected.get());
    }

    @Test
    @DisplayName("A redelivered event should be reported as a duplicate and not counted again")
    void shouldDetectRedelivery() {
        AlertEvaluator alwaysNew = (previous, merged, count, now) ->
                previous == null ? Optional.of(AlertReason.NEW_SIGNATURE) : Optional.empty();

        UpsertResult first = store.upsertAndMerge(NPE, 5, T0, alwaysNew);
        UpsertResult again = store.upsertAndMerge(NPE, 5, T0, alwaysNew);

        assertThat(first.isNewSignature()).isTrue();
        assertThat(first.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(first.getCurrent().getLastAlertAt()).isEqualTo(T0);
        assertThat(again.isDuplicate()).isTrue();
        assertThat(again.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(again.getCurrent().getTotalOccurrences()).isEqualTo(5);
        assertThat(again.getCurrent().getVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("After the dedup window an identical event should count again")
    void shouldForgetProcessedEventsAfterWindow() {
        store.upsertAndMerge(NPE, 5, T0);
        clock.advance(Duration.ofHours(2));

        UpsertResult result = store.upsertAndMerge(NPE, 5, T0, AlertEvaluator.NEVER);

        assertThat(result.isDuplicate()).isFalse();
        assertThat(result.getCurrent().getTotalOccurrences()).isEqualTo(10);
    }

    @Test
    @DisplayName("Only the first claim for a signature and observedAt should win until released")
    void shouldClaimPublicationOnce() {
        store.upsertAndMerge(NPE, 5, T0);

        assertThat(store.claimPublication(NPE, T0)).isTrue();
        assertThat(store.claimPublication(NPE, T0)).isFalse();
        assertThat(store.claimPublication(NPE, T0.plusSeconds(1))).isTrue();

        store.releasePublication(NPE, T0);
        assertThat(store.claimPublication(NPE, T0)).isTrue();

        clock.advance(Duration.ofHours(1).plusSeconds(1));
        assertThat(store.claimPublication(NPE, T0)).as("claims expire with the dedup window").isTrue();
    }

    @Test
    @DisplayName("An unconfirmed claim should block only for its lease, a confirmed one for the dedup window")
    void shouldExpirePendingClaimsAfterLease() {
        policy.setClaimLeaseMillis(30_000);
        store = new SignatureStore(records, policy, clock);
        store.upsertAndMerge(NPE, 5, T0);

        assertThat(store.claimPublication(NPE, T0)).isTrue();
        clock.advance(Duration.ofSeconds(29));
        assertThat(store.claimPublication(NPE, T0)).as("in flight elsewhere").isFalse();

        clock.advance(Duration.ofSeconds(2));
        assertThat(store.claimPublication(NPE, T0)).as("abandoned claim is taken over").isTrue();
        assertThat(store.get(NPE).orElseThrow().getPublications()).hasSize(1);

        store.confirmPublication(NPE, T0);
        clock.advance(Duration.ofMinutes(30));
        assertThat(store.claimPublication(NPE, T0)).as("confirmed within the dedup window").isFalse();

        clock.advance(Duration.ofMinutes(31));
        assertThat(store.claimPublication(NPE, T0)).isTrue();
    }

    @Test
    @DisplayName("Claiming without history should fail")
    void shouldRejectClaimForUnknownSignature() {
        assertThatThrownBy(() -> store.claimPublication(NPE, T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Exhausted conflict retries should surface as StoreUnavailable caused by StoreConflict")
    void shouldEscalateConflicts() {
        policy.setMaxConflictRetries(3);
        RecordStore alwaysConflicting = new RecordStore() {
            @Override
            public Optional<HistoryRecord> load(ErrorSignature signature) {
                return Optional.empty();
            }

            @Override
            public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
                return false;
            }
        };
        SignatureStore contended = new SignatureStore(alwaysConflicting, policy, clock);

        assertThatThrownBy(() -> contended.upsertAndMerge(NPE, 1, T0))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(StoreConflictException.class);
    }
}
