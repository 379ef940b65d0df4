package io.trading.dumper.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.dumper.config.ChartConfig;
import io.trading.dumper.config.DumperConfig;
import io.trading.dumper.core.HealthMonitor;
import io.trading.dumper.core.SourcePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, status, health, and config endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final DumperMetrics metrics;
    private final DumperConfig config;
    private final HealthMonitor healthMonitor;
    private final Supplier<Collection<SourcePipeline>> pipelines;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(int port, DumperMetrics metrics, DumperConfig config, HealthMonitor healthMonitor,
                         Supplier<Collection<SourcePipeline>> pipelines) {
        this.port = port;
        this.metrics = metrics;
        this.config = config;
        this.healthMonitor = healthMonitor;
        this.pipelines = pipelines;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        // Metrics endpoint (Prometheus)
        server.createContext("/metrics", handleMetrics());

        // Health endpoint (simple)
        server.createContext("/health", handleHealthSimple());

        // REST API endpoints
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/config", handleConfig());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  Health:     http://localhost:{}/health", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
        LOGGER.info("  API Health: http://localhost:{}/api/health", boundPort);
        LOGGER.info("  API Config: http://localhost:{}/api/config", boundPort);
    }

    /**
     * Port the server is bound to; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> {
            try {
                sendResponse(exchange, 200, "text/plain", "OK");
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                Map<String, ChartStatusInfo> charts = new TreeMap<>();

                for (SourcePipeline pipeline : pipelines.get()) {
                    HealthMonitor.ChartStats stats = healthMonitor.getStats(pipeline.getSource().chart());
                    charts.put(Integer.toString(pipeline.getSource().chart()), new ChartStatusInfo(
                        pipeline.getSource().symbol(),
                        pipeline.isConnected(),
                        stats != null && stats.isStale(),
                        pipeline.getUpdateCount(),
                        metrics.getTotalEmitted(pipeline.getSource()),
                        pipeline.getRejectedCount(),
                        pipeline.getLastUpdateMillis(),
                        pipeline.getEngine().features().toString()
                    ));
                }

                StatusResponse statusResponse = new StatusResponse(
                    config.dumperId(),
                    System.currentTimeMillis() - startTime,
                    charts
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(statusResponse);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                List<String> problems = new ArrayList<>();
                for (SourcePipeline pipeline : pipelines.get()) {
                    HealthMonitor.ChartStats stats = healthMonitor.getStats(pipeline.getSource().chart());
                    if (!pipeline.isConnected()) {
                        problems.add(pipeline.getSource() + " disconnected");
                    } else if (stats != null && stats.isStale()) {
                        problems.add(pipeline.getSource() + " stale");
                    }
                }

                boolean healthy = problems.isEmpty();
                String message = healthy ? "All charts operational" : String.join(", ", problems);
                HealthResponse health = new HealthResponse(healthy, message);
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                sendJsonResponse(exchange, healthy ? 200 : 503, response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                List<String> charts = new ArrayList<>();
                for (ChartConfig chart : config.charts()) {
                    charts.add(chart.source() + " " + chart.features());
                }
                ConfigInfo configInfo = new ConfigInfo(
                    config.dumperId(),
                    config.outputDir(),
                    config.logZone().getId(),
                    charts,
                    config.depthLevels(),
                    config.vwapBands(),
                    config.pvwapBands(),
                    config.sourceProvider(),
                    config.healthCheckMs(),
                    config.metricsPort(),
                    config.aeronEnabled()
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        sendResponse(exchange, statusCode, "application/json", response);
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response)
            throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String dumperId, long uptimeMs, Map<String, ChartStatusInfo> charts) {}
    private record ChartStatusInfo(String symbol, boolean connected, boolean stale, long updates, long emitted,
                                   long rejected, long lastUpdateMillis, String features) {}
    private record HealthResponse(boolean healthy, String message) {}
    private record ConfigInfo(String dumperId, String outputDir, String logZone, List<String> charts,
                              int depthLevels, int vwapBands, int pvwapBands, String sourceProvider,
                              int healthCheckMs, int metricsPort, boolean aeronEnabled) {}
}
