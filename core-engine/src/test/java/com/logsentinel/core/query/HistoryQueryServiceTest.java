package com.logsentinel.core.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.MutableClock;
import com.logsentinel.core.config.StorePolicy;
import com.logsentinel.core.exception.InvalidQueryException;
import com.logsentinel.core.exception.QueryFailedException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.LogLevel;
import com.logsentinel.core.store.InMemoryRecordStore;
import com.logsentinel.core.store.RecordStore;
import com.logsentinel.core.store.SignatureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HistoryQueryService}.
 */
class HistoryQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:30:00Z");
    private static final ErrorSignature NPE = ErrorSignature.of(LogLevel.ERROR, "NullPointerException");

    private SignatureStore store;
    private HistoryQueryService service;

    @BeforeEach
    void setUp() {
        store = new SignatureStore(new InMemoryRecordStore(), new StorePolicy(), new MutableClock(NOW));
        store.upsertAndMerge(NPE, 5, NOW.minus(Duration.ofHours(2)));
        store.upsertAndMerge(NPE, 8, NOW.minus(Duration.ofHours(1)));
        store.upsertAndMerge(NPE, 3, NOW);
        service = new HistoryQueryService(store);
    }

    @Test
    @DisplayName("Should answer with the signature string, lookback and count")
    void shouldReportOccurrences() {
        OccurrenceReport report = service.query(OccurrenceQuery.of("ERROR", "NullPointerException", 24));

        assertThat(report).isEqualTo(new OccurrenceReport("ERROR: NullPointerException", 24, 16));
    }

    @Test
    @DisplayName("Should accept the combined signature form and default the lookback to 24 hours")
    void shouldAcceptSignatureString() {
        OccurrenceReport report = service.query(OccurrenceQuery.ofSignature("error: NullPointerException", null));

        assertThat(report.getSignature()).isEqualTo("ERROR: NullPointerException");
        assertThat(report.getLookbackHours()).isEqualTo(24);
        assertThat(report.getOccurrenceCount()).isEqualTo(16);
    }

    @Test
    @DisplayName("Unknown signature should report 0, not an error")
    void shouldReportZeroForUnknownSignature() {
        OccurrenceReport report = service.query(OccurrenceQuery.of("INFO", "cache warmed", 24));

        assertThat(report.getOccurrenceCount()).isZero();
    }

    @Test
    @DisplayName("Malformed queries should fail with a readable client error")
    void shouldRejectMalformedQueries() {
        assertThatThrownBy(() -> service.query(OccurrenceQuery.of(null, "NullPointerException", 24)))
                .isInstanceOf(InvalidQueryException.class).hasMessage("level is required");
        assertThatThrownBy(() -> service.query(OccurrenceQuery.of("ERROR", " ", 24)))
                .isInstanceOf(InvalidQueryException.class).hasMessage("message is required");
        assertThatThrownBy(() -> service.query(OccurrenceQuery.of("LOUD", "x", 24)))
                .isInstanceOf(InvalidQueryException.class).hasMessageContaining("Unknown log level");
        assertThatThrownBy(() -> service.query(OccurrenceQuery.of("ERROR", "x", 0)))
                .isInstanceOf(InvalidQueryException.class).hasMessageContaining("positive");
        assertThatThrownBy(() -> service.query(OccurrenceQuery.ofSignature("no separator", 24)))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("Store failures should surface as QueryFailed carrying the cause message")
    void shouldWrapStoreFailures() {
        RecordStore broken = new RecordStore() {
            @Override
            public Optional<HistoryRecord> load(ErrorSignature signature) {
                throw new StoreUnavailableException("disk unreadable", new IOException("EIO"));
            }

            @Override
            public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
                return false;
            }
        };
        HistoryQueryService failing = new HistoryQueryService(
                new SignatureStore(broken, new StorePolicy(), new MutableClock(NOW)));

        assertThatThrownBy(() -> failing.query(OccurrenceQuery.of("ERROR", "NullPointerException", 24)))
                .isInstanceOf(QueryFailedException.class)
                .hasMessageContaining("disk unreadable")
                .hasMessageContaining("ERROR: NullPointerException");
    }

    @Test
    @DisplayName("Report should serialize with the wire field names")
    void shouldSerializeWireFormat() throws Exception {
        String json = new ObjectMapper().writeValueAsString(new OccurrenceReport("ERROR: x", 24, 16));

        assertThat(json).isEqualTo("{\"signature\":\"ERROR: x\",\"lookback_hours\":24,\"occurrence_count\":16}");
    }
}
