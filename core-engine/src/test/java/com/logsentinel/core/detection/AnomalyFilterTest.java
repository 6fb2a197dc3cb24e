package com.logsentinel.core.detection;

import com.logsentinel.core.MutableClock;
import com.logsentinel.core.config.FilterPolicy;
import com.logsentinel.core.config.RetryPolicy;
import com.logsentinel.core.config.StorePolicy;
import com.logsentinel.core.exception.InvalidEventException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.AlertDecision;
import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.ClusterEvent;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.LogLevel;
import com.logsentinel.core.store.InMemoryRecordStore;
import com.logsentinel.core.store.RecordStore;
import com.logsentinel.core.store.SignatureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyFilter}.
 */
class AnomalyFilterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:05:00Z");
    private static final ErrorSignature NPE = ErrorSignature.of(LogLevel.ERROR, "NullPointerException");
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, 1, 1.0, 1);

    private MutableClock clock;
    private InMemoryRecordStore records;
    private SignatureStore store;
    private AnomalyFilter filter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        records = new InMemoryRecordStore();
        store = new SignatureStore(records, new StorePolicy(), clock);
        filter = new AnomalyFilter(store, new FilterPolicy(), FAST_RETRY, clock);
    }

    @Test
    @DisplayName("A never-seen signature should alert as NEW_SIGNATURE")
    void shouldAlertOnNewSignature() {
        AlertDecision decision = filter.decide(event(NPE, 5, T0));

        assertThat(decision.isAnomalous()).isTrue();
        assertThat(decision.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(decision.getOccurrenceCount()).isEqualTo(5);
        assertThat(decision.getLookbackHours()).isEqualTo(24);
        assertThat(decision.getWindowOccurrences()).isEqualTo(5);
        assertThat(decision.getDecidedAt()).isEqualTo(T0);
        assertThat(decision.getSampleContext()).isEqualTo("sample");
        assertThat(decision.isRedelivered()).isFalse();
        assertThat(store.get(NPE).orElseThrow().getLastAlertAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Count above baseline times factor should alert as RATE_SPIKE, then a normal count is noise")
    void shouldDetectRateSpikeThenSuppress() {
        ErrorSignature sig = ErrorSignature.of(LogLevel.ERROR, "Timeout calling billing");
        filter.decide(eventAt(sig, 2, T0));

        AlertDecision quiet = filter.decide(eventAt(sig, 2, T0.plus(Duration.ofHours(1))));
        assertThat(quiet.isAnomalous()).as("baseline still undefined").isFalse();

        AlertDecision spike = filter.decide(eventAt(sig, 8, T0.plus(Duration.ofHours(2))));
        assertThat(spike.isAnomalous()).isTrue();
        assertThat(spike.getReason()).isEqualTo(AlertReason.RATE_SPIKE);
        assertThat(store.get(sig).orElseThrow().getBaselineRate()).isEqualTo(2.0);

        AlertDecision normal = filter.decide(eventAt(sig, 3, T0.plus(Duration.ofHours(3))));
        assertThat(normal.isAnomalous()).isFalse();
        assertThat(normal.getReason()).isNull();
        HistoryRecord record = store.get(sig).orElseThrow();
        assertThat(record.getTotalOccurrences()).as("noise still accumulates").isEqualTo(15);
        assertThat(record.getLastAlertAt()).isEqualTo(T0.plus(Duration.ofHours(2)));
    }

    @Test
    @DisplayName("Counts 5, 8 and 3 in successive hours should sum to 16 within 24 hours")
    void shouldAccumulateScenarioCounts() {
        filter.decide(eventAt(NPE, 5, T0));
        AlertDecision second = filter.decide(eventAt(NPE, 8, T0.plus(Duration.ofHours(1))));
        AlertDecision third = filter.decide(eventAt(NPE, 3, T0.plus(Duration.ofHours(2))));

        assertThat(second.getReason()).as("alerted within the last day and above the repeat floor")
                .isEqualTo(AlertReason.RECURRING);
        assertThat(third.isAnomalous()).isFalse();
        assertThat(third.getWindowOccurrences()).isEqualTo(16);
        assertThat(store.queryOccurrences(NPE, 24)).isEqualTo(16);
    }

    @Test
    @DisplayName("Count at the absolute floor should alert as VOLUME_THRESHOLD without a baseline")
    void shouldAlertOnVolume() {
        filter.decide(eventAt(NPE, 1, T0));
        clock.advance(Duration.ofDays(2));

        AlertDecision decision = filter.decide(eventAt(NPE, 10, clock.instant()));

        assertThat(decision.getReason()).isEqualTo(AlertReason.VOLUME_THRESHOLD);
    }

    @Test
    @DisplayName("Redelivering the same event should neither double-count nor produce a fresh alert")
    void shouldBeIdempotentOnRedelivery() {
        ClusterEvent event = event(NPE, 5, T0);

        AlertDecision first = filter.decide(event);
        clock.advance(Duration.ofMinutes(10));
        AlertDecision again = filter.decide(event);

        assertThat(first.isRedelivered()).isFalse();
        assertThat(again.isRedelivered()).isTrue();
        assertThat(again.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(again.getObservedAt()).isEqualTo(first.getObservedAt());
        HistoryRecord record = store.get(NPE).orElseThrow();
        assertThat(record.getTotalOccurrences()).isEqualTo(5);
        assertThat(record.getLastAlertAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Malformed events should be rejected and never persisted")
    void shouldRejectInvalidEvents() {
        assertThatThrownBy(() -> filter.decide(event(NPE, 0, T0)))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("occurrenceCount");
        assertThatThrownBy(() -> filter.decide(event(NPE, -3, T0)))
                .isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> filter.decide(event(NPE, 5, null)))
                .isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> filter.decide(new ClusterEvent()))
                .isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> filter.decide(null))
                .isInstanceOf(InvalidEventException.class);

        assertThat(records.size()).isZero();
    }

    @Test
    @DisplayName("Events dated beyond the clock skew tolerance should be rejected and not persisted")
    void shouldRejectFarFutureEvents() {
        assertThatThrownBy(() -> filter.decide(event(NPE, 5, T0.plus(Duration.ofHours(9)))))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("ahead of");
        assertThat(records.size()).isZero();

        AlertDecision slightlyAhead = filter.decide(event(NPE, 5, T0.plusSeconds(299)));
        assertThat(slightlyAhead.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(store.get(NPE).orElseThrow().getWindowBuckets()).hasSize(1);
    }

    @Test
    @DisplayName("Transient store failures should be retried with backoff")
    void shouldRetryUnavailableStore() {
        FlakyRecordStore flaky = new FlakyRecordStore(records, 2);
        AnomalyFilter retrying = new AnomalyFilter(new SignatureStore(flaky, new StorePolicy(), clock),
                new FilterPolicy(), FAST_RETRY, clock);

        AlertDecision decision = retrying.decide(event(NPE, 5, T0));

        assertThat(decision.getReason()).isEqualTo(AlertReason.NEW_SIGNATURE);
        assertThat(flaky.failures.get()).isEqualTo(2);
        assertThat(records.load(NPE)).isPresent();
    }

    @Test
    @DisplayName("A store that stays down should surface StoreUnavailable after the retries")
    void shouldSurfaceExhaustedRetries() {
        FlakyRecordStore down = new FlakyRecordStore(records, Integer.MAX_VALUE);
        AnomalyFilter retrying = new AnomalyFilter(new SignatureStore(down, new StorePolicy(), clock),
                new FilterPolicy(), FAST_RETRY, clock);

        assertThatThrownBy(() -> retrying.decide(event(NPE, 5, T0)))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(down.failures.get()).isEqualTo(3);
        assertThat(records.size()).isZero();
    }

    @Test
    @DisplayName("Should refuse an inconsistent filter policy")
    void shouldValidatePolicy() {
        FilterPolicy policy = new FilterPolicy();
        policy.setSpikeFactor(0);

        assertThatThrownBy(() -> new AnomalyFilter(store, policy, FAST_RETRY, clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spikeFactor");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ClusterEvent eventAt(ErrorSignature signature, long count, Instant at) {
        clock.set(at);
        return event(signature, count, at);
    }

    private static ClusterEvent event(ErrorSignature signature, long count, Instant observedAt) {
        return ClusterEvent.builder()
                .signature(signature)
                .occurrenceCount(count)
                .observedAt(observedAt)
                .sampleContext("sample")
                .build();
    }

    /** Fails the first {@code failuresBeforeRecovery} loads. */
    private static final class FlakyRecordStore implements RecordStore {
        private final RecordStore delegate;
        private final int failuresBeforeRecovery;
        private final AtomicInteger failures = new AtomicInteger();

        private FlakyRecordStore(RecordStore delegate, int failuresBeforeRecovery) {
            this.delegate = delegate;
            this.failuresBeforeRecovery = failuresBeforeRecovery;
        }

        @Override
        public Optional<HistoryRecord> load(ErrorSignature signature) {
            if (failures.get() < failuresBeforeRecovery) {
                failures.incrementAndGet();
                throw new StoreUnavailableException("connection reset", null);
            }
            return delegate.load(signature);
        }

        @Override
        public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
            return delegate.compareAndSet(signature, expectedVersion, updated);
        }
    }
}
