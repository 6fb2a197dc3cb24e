package com.logsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.config.StorePolicy;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import com.logsentinel.core.model.LogLevel;
import com.logsentinel.core.query.HistoryQueryService;
import com.logsentinel.core.store.InMemoryRecordStore;
import com.logsentinel.core.store.RecordStore;
import com.logsentinel.core.store.SignatureStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link QueryServer} over a real loopback socket.
 */
class QueryServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private QueryServer server;

    @BeforeEach
    void setUp() {
        SignatureStore store = new SignatureStore(new InMemoryRecordStore(), new StorePolicy(), Clock.systemUTC());
        Instant now = Instant.now();
        store.upsertAndMerge(ErrorSignature.of(LogLevel.ERROR, "NullPointerException"), 5, now);
        store.upsertAndMerge(ErrorSignature.of(LogLevel.ERROR, "NullPointerException"), 8, now.minusSeconds(1));
        server = new QueryServer(new HistoryQueryService(store));
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Health and readiness should report UP")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> health = get("/health");
        HttpResponse<String> readiness = get("/readiness");

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(readiness.statusCode()).isEqualTo(200);
        assertThat(server.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should answer a history query by level and message")
    void shouldAnswerHistoryQuery() throws Exception {
        HttpResponse<String> response = get("/history?level=error&message=NullPointerException&hours=24");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode json = mapper.readTree(response.body());
        assertThat(json.get("signature").asText()).isEqualTo("ERROR: NullPointerException");
        assertThat(json.get("lookback_hours").asInt()).isEqualTo(24);
        assertThat(json.get("occurrence_count").asLong()).isEqualTo(13);
    }

    @Test
    @DisplayName("Should answer a history query by encoded signature with the default lookback")
    void shouldAnswerBySignature() throws Exception {
        HttpResponse<String> response = get("/history?signature=ERROR%3A%20NullPointerException");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("occurrence_count").asLong()).isEqualTo(13);
    }

    @Test
    @DisplayName("Unknown signatures should count 0")
    void shouldAnswerZeroForUnknown() throws Exception {
        HttpResponse<String> response = get("/history?level=INFO&message=nothing%20here");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("occurrence_count").asLong()).isZero();
    }

    @Test
    @DisplayName("Malformed queries should get 400 with a readable message and no stack trace")
    void shouldRejectMalformedQuery() throws Exception {
        HttpResponse<String> missing = get("/history?message=NullPointerException");
        HttpResponse<String> badHours = get("/history?level=ERROR&message=x&hours=soon");
        HttpResponse<String> zeroHours = get("/history?level=ERROR&message=x&hours=0");

        assertThat(missing.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(missing.body()).get("message").asText()).isEqualTo("level is required");
        assertThat(badHours.statusCode()).isEqualTo(400);
        assertThat(badHours.body()).contains("hours").doesNotContain("Exception");
        assertThat(zeroHours.statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Store failures should get 500 with the underlying cause")
    void shouldReportStoreFailure() throws Exception {
        RecordStore broken = new RecordStore() {
            @Override
            public Optional<HistoryRecord> load(ErrorSignature signature) {
                throw new StoreUnavailableException("store offline", null);
            }

            @Override
            public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
                return false;
            }
        };
        server.stop();
        server = new QueryServer(new HistoryQueryService(
                new SignatureStore(broken, new StorePolicy(), Clock.systemUTC())));
        server.start(0);

        HttpResponse<String> response = get("/history?level=ERROR&message=x");

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(mapper.readTree(response.body()).get("message").asText()).contains("store offline");
    }

    @Test
    @DisplayName("Should reject ports out of range")
    void shouldRejectBadPort() {
        QueryServer other = new QueryServer(new HistoryQueryService(
                new SignatureStore(new InMemoryRecordStore(), new StorePolicy(), Clock.systemUTC())));

        assertThatThrownBy(() -> other.start(70_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(other::getPort).isInstanceOf(IllegalStateException.class);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
