package com.telemetrysentinel.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.WATCHING);
    private final PipelineMetrics metrics = new PipelineMetrics();
    private HealthServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Should report UP with the pipeline state while watching")
    void shouldReportUp() throws Exception {
        server = started();

        HttpResponse<String> response = get("/health");
        JsonNode body = MAPPER.readTree(response.body());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("state").asText()).isEqualTo("WATCHING");
        assertThat(body.get("checkedAt").asText()).endsWith("Z");
    }

    @Test
    @DisplayName("Should report DOWN once the pipeline is draining")
    void shouldReportDown() throws Exception {
        server = started();
        state.set(PipelineState.DRAINING);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(MAPPER.readTree(response.body()).get("status").asText()).isEqualTo("DOWN");
    }

    @Test
    @DisplayName("Should expose the metrics snapshot as JSON")
    void shouldExposeMetrics() throws Exception {
        server = started();
        metrics.incrementArrivals();
        metrics.recordOutcome(UnitOutcome.nothingToScore(Path.of("/in/a.csv")), Duration.ofMillis(5));

        JsonNode body = MAPPER.readTree(get("/metrics").body());

        assertThat(body.get("arrivals_detected_total").asLong()).isEqualTo(1);
        assertThat(body.get("units_skipped_total").asLong()).isEqualTo(1);
        assertThat(body.get("unit_processing_count").asLong()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should throw for port out of range")
    void shouldRejectInvalidPort() {
        server = new HealthServer(state::get, metrics);

        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("65535");
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should stop idempotently")
    void shouldStopIdempotently() throws IOException {
        server = started();

        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    // Helpers

    private HealthServer started() throws IOException {
        HealthServer s = new HealthServer(state::get, metrics);
        s.start(0);
        return s;
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
