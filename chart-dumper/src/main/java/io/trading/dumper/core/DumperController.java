package io.trading.dumper.core;

import io.aeron.Aeron;
import io.aeron.driver.MediaDriver;
import io.aeron.driver.ThreadingMode;
import io.trading.dumper.aeron.AeronEventPublisher;
import io.trading.dumper.config.ChartConfig;
import io.trading.dumper.config.DumperConfig;
import io.trading.dumper.host.MarketDataSourceProvider;
import io.trading.dumper.host.SourceProviders;
import io.trading.dumper.metrics.DumperMetrics;
import io.trading.dumper.metrics.MetricsServer;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.emit.EventLogWriter;
import io.trading.marketevent.engine.ChartEventEngine;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main controller for the Chart Dumper.
 * Wires the host source, one engine pipeline per chart, the event log, the optional
 * Aeron live mirror, health monitoring and the metrics server.
 */
public class DumperController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DumperController.class);

    private static final long STATUS_LOG_INTERVAL_SECONDS = 60;

    private final DumperConfig config;
    private final MediaDriver mediaDriver;
    private final Aeron aeron;
    private final AeronEventPublisher publisher;
    private final EventLogWriter writer;
    private final HealthMonitor healthMonitor;
    private final DumperMetrics metrics;
    private final MetricsServer metricsServer;
    private final ProcessingTimer processingTimer;
    private final Map<Integer, SourcePipeline> pipelines;
    private final ShutdownSignalBarrier shutdownBarrier;
    private final ScheduledExecutorService scheduler;
    private final MarketDataSourceProvider provider;

    private MarketDataSource data;

    public DumperController(DumperConfig config) {
        this(config, new DumperMetrics(), SourceProviders.find(config.sourceProvider()));
    }

    public DumperController(DumperConfig config, DumperMetrics metrics, MarketDataSourceProvider provider) {
        this.config = config;
        this.metrics = metrics;
        this.provider = provider;

        if (config.aeronEnabled()) {
            this.mediaDriver = launchMediaDriver(config);
            Aeron.Context context = new Aeron.Context()
                .aeronDirectoryName(mediaDriver.aeronDirectoryName());
            this.aeron = Aeron.connect(context);
            this.publisher = new AeronEventPublisher(aeron, metrics);
        } else {
            this.mediaDriver = null;
            this.aeron = null;
            this.publisher = null;
            LOGGER.info("Aeron live mirror disabled");
        }

        this.writer = new EventLogWriter(Paths.get(config.outputDir()), config.logZone(), metrics, publisher);
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), config.staleAfterMs());
        this.pipelines = new LinkedHashMap<>();
        this.metricsServer = new MetricsServer(config.metricsPort(), metrics, config, healthMonitor,
            this::getPipelines);
        this.processingTimer = new ProcessingTimer();
        this.shutdownBarrier = new ShutdownSignalBarrier();
        this.scheduler = Executors.newScheduledThreadPool(2);

        LOGGER.info("Dumper controller initialized: {}", config.dumperId());
    }

    private static MediaDriver launchMediaDriver(DumperConfig config) {
        String aeronDir = config.aeronDir();

        // Use temp directory if /dev/shm is not available (e.g., on macOS)
        if (!Files.exists(Paths.get("/dev/shm"))) {
            aeronDir = System.getProperty("java.io.tmpdir") + "/chart-dumper-" + config.dumperId();
            LOGGER.info("Using temp directory for Aeron: {}", aeronDir);
        }

        try {
            Path dirPath = Paths.get(aeronDir);
            if (!Files.exists(dirPath)) {
                Files.createDirectories(dirPath);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not create Aeron directory: {}", aeronDir, e);
        }

        MediaDriver.Context mediaDriverContext = new MediaDriver.Context()
            .aeronDirectoryName(aeronDir)
            .threadingMode(ThreadingMode.SHARED)
            .dirDeleteOnStart(true);

        MediaDriver driver = MediaDriver.launchEmbedded(mediaDriverContext);
        LOGGER.info("Media driver started: dir={}", aeronDir);
        return driver;
    }

    /**
     * Connects the host source and starts one pipeline per chart.
     */
    public void start() throws IOException {
        LOGGER.info("Starting Chart Dumper...");

        data = provider.connect(config, this::onChartUpdated);
        LOGGER.info("Connected market data source: {}", provider.name());

        for (ChartConfig chartConfig : config.charts()) {
            ChartEventEngine engine = new ChartEventEngine(
                chartConfig.source(), data, config.engineConfig(chartConfig), writer, metrics);
            SourcePipeline pipeline = new SourcePipeline(engine, data, metrics, processingTimer);
            synchronized (pipelines) {
                pipelines.put(chartConfig.chart(), pipeline);
            }
            healthMonitor.registerChart(chartConfig.chart(), pipeline);
            LOGGER.info("Started pipeline for {} with features {}", chartConfig.source(), engine.features());
        }

        healthMonitor.start();
        metricsServer.start();

        if (config.pollMs() > 0) {
            scheduler.scheduleAtFixedRate(this::pollAll, config.pollMs(), config.pollMs(), TimeUnit.MILLISECONDS);
            LOGGER.info("Polling every {} ms", config.pollMs());
        }
        scheduler.scheduleAtFixedRate(this::logStatus,
            STATUS_LOG_INTERVAL_SECONDS, STATUS_LOG_INTERVAL_SECONDS, TimeUnit.SECONDS);

        LOGGER.info("Chart Dumper started successfully");
        logStatus();
    }

    /**
     * Routes a host notification to the chart's pipeline.
     */
    public void onChartUpdated(int chart) {
        SourcePipeline pipeline;
        synchronized (pipelines) {
            pipeline = pipelines.get(chart);
        }
        if (pipeline == null) {
            LOGGER.debug("Ignoring update for unconfigured chart {}", chart);
            return;
        }
        pipeline.notifyUpdated();
    }

    private void pollAll() {
        for (SourcePipeline pipeline : getPipelines()) {
            pipeline.notifyUpdated();
        }
    }

    /**
     * Snapshot of the running pipelines, in configuration order.
     */
    public Collection<SourcePipeline> getPipelines() {
        synchronized (pipelines) {
            return new ArrayList<>(pipelines.values());
        }
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Dumper running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the dumper gracefully; queued updates are drained before the log closes.
     */
    public void shutdown() {
        LOGGER.info("Shutting down Chart Dumper...");

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<SourcePipeline> running = new ArrayList<>(getPipelines());
        CloseHelper.closeAll(running);
        synchronized (pipelines) {
            pipelines.clear();
        }
        CloseHelper.closeAll(writer, publisher, healthMonitor, metricsServer);
        if (data instanceof AutoCloseable) {
            CloseHelper.quietClose((AutoCloseable) data);
        }
        CloseHelper.close(aeron);
        CloseHelper.close(mediaDriver);

        LOGGER.info("Chart Dumper shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current dumper status.
     */
    public void logStatus() {
        LOGGER.info("=== Dumper Status ===");
        LOGGER.info("Dumper ID: {}", config.dumperId());
        LOGGER.info("Output Dir: {}", config.outputDir());
        LOGGER.info("Lines Written: {}", writer.getLinesWritten());
        LOGGER.info("Write Failures: {}", writer.getWriteFailures());
        LOGGER.info("Open Partitions: {}", writer.getOpenPartitionCount());
        if (publisher != null) {
            LOGGER.info("Active Publications: {}", publisher.getPublicationCount());
            LOGGER.info("Publish Failures: {}", publisher.getPublishFailureCount());
        }

        for (SourcePipeline pipeline : getPipelines()) {
            LOGGER.info("{}: connected={}, updates={}, emitted={}, rejected={}",
                pipeline.getSource(),
                pipeline.isConnected(),
                pipeline.getUpdateCount(),
                metrics.getTotalEmitted(pipeline.getSource()),
                pipeline.getRejectedCount()
            );
        }

        LOGGER.info("--- Update Latency Stats ---");
        logProcessingStats(processingTimer, "UPDATE");
        if (publisher != null) {
            LOGGER.info("--- Publish Latency Stats ---");
            logProcessingStats(publisher.getProcessingTimer(), "PUBLISH");
        }

        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }

    private void logProcessingStats(ProcessingTimer timer, String label) {
        for (Map.Entry<ProcessingTimer.TimerKey, ProcessingTimer.TimerStats> entry :
             timer.getAllStats().entrySet()) {
            ProcessingTimer.TimerStats stats = entry.getValue();
            if (stats.getCount() > 0) {
                LOGGER.info("  [{}] {}: count={}, avg={} us, min={} us, max={} us",
                    label,
                    entry.getKey(),
                    stats.getCount(),
                    String.format("%.2f", stats.getAvgMicros()),
                    stats.getMinMicros(),
                    stats.getMaxMicros()
                );
            }
        }
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public EventLogWriter getWriter() {
        return writer;
    }

    public int getMetricsPort() {
        return metricsServer.getPort();
    }
}
