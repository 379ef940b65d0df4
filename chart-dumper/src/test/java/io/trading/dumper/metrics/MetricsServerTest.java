package io.trading.dumper.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.dumper.config.ChartConfig;
import io.trading.dumper.config.DumperConfig;
import io.trading.dumper.core.HealthMonitor;
import io.trading.dumper.core.ProcessingTimer;
import io.trading.dumper.core.SourcePipeline;
import io.trading.marketevent.engine.ChartEventEngine;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.source.InMemoryMarketDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetricsServer.
 */
class MetricsServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryMarketDataSource data;
    private DumperMetrics metrics;
    private HealthMonitor healthMonitor;
    private SourcePipeline pipeline;
    private MetricsServer server;

    @BeforeEach
    void setUp() throws IOException {
        ChartConfig chart = ChartConfig.fromString("3:ESU25_FUT_CME:basedata");
        DumperConfig config = DumperConfig.builder()
            .dumperId("dumper-test")
            .addChart(chart)
            .build();

        data = new InMemoryMarketDataSource();
        metrics = new DumperMetrics(new CollectorRegistry());
        ChartEventEngine engine = new ChartEventEngine(chart.source(), data, config.engineConfig(chart),
            event -> true, metrics);
        pipeline = new SourcePipeline(engine, data, metrics, new ProcessingTimer());
        healthMonitor = new HealthMonitor(1000, 60_000);
        healthMonitor.registerChart(3, pipeline);

        server = new MetricsServer(0, metrics, config, healthMonitor, () -> List.of(pipeline));
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        healthMonitor.close();
        pipeline.close();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testPrometheusEndpoint() throws Exception {
        metrics.onEmitted(pipeline.getSource(), EventType.BASEDATA);

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("dumper_events_emitted_total{chart=\"3\",type=\"basedata\",} 1.0"));
    }

    @Test
    void testSimpleHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("OK", response.body());
    }

    @Test
    void testStatus() throws Exception {
        metrics.onEmitted(pipeline.getSource(), EventType.BASEDATA);
        metrics.onEmitted(pipeline.getSource(), EventType.QUOTE);

        HttpResponse<String> response = get("/api/status");

        assertEquals(200, response.statusCode());
        JsonNode status = mapper.readTree(response.body());
        assertEquals("dumper-test", status.get("dumperId").asText());
        JsonNode chart = status.get("charts").get("3");
        assertEquals("ESU25_FUT_CME", chart.get("symbol").asText());
        assertTrue(chart.get("connected").asBoolean());
        assertEquals(2, chart.get("emitted").asLong());
        assertEquals(0, chart.get("updates").asLong());
    }

    @Test
    void testApiHealthReportsDisconnectedChart() throws Exception {
        HttpResponse<String> healthy = get("/api/health");
        assertEquals(200, healthy.statusCode());
        assertTrue(mapper.readTree(healthy.body()).get("healthy").asBoolean());

        data.setConnected(3, false);
        HttpResponse<String> unhealthy = get("/api/health");

        assertEquals(503, unhealthy.statusCode());
        JsonNode body = mapper.readTree(unhealthy.body());
        assertFalse(body.get("healthy").asBoolean());
        assertTrue(body.get("message").asText().contains("disconnected"));
    }

    @Test
    void testConfig() throws Exception {
        HttpResponse<String> response = get("/api/config");

        assertEquals(200, response.statusCode());
        JsonNode config = mapper.readTree(response.body());
        assertEquals("dumper-test", config.get("dumperId").asText());
        assertEquals("UTC", config.get("logZone").asText());
        assertEquals(1, config.get("charts").size());
        assertEquals("memory", config.get("sourceProvider").asText());
    }
}
