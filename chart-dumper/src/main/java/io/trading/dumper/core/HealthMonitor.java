package io.trading.dumper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Periodically checks every chart pipeline: host connection and time since the
 * last processed update. A connected chart that stopped updating is stale.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final long staleAfterMs;
    private final LongSupplier clock;
    private final ScheduledExecutorService scheduler;
    private final Map<Integer, ChartStats> statsMap = new ConcurrentSkipListMap<>();

    private volatile boolean running = false;

    public HealthMonitor(long checkIntervalMs, long staleAfterMs, LongSupplier clock) {
        this.checkIntervalMs = checkIntervalMs;
        this.staleAfterMs = staleAfterMs;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public HealthMonitor(long checkIntervalMs, long staleAfterMs) {
        this(checkIntervalMs, staleAfterMs, System::currentTimeMillis);
    }

    /**
     * Registers a chart for monitoring.
     */
    public void registerChart(int chart, ChartChecker checker) {
        statsMap.put(chart, new ChartStats(chart, checker));
    }

    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms, stale after: {} ms)", checkIntervalMs, staleAfterMs);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Checks all registered charts once.
     */
    void performHealthCheck() {
        long now = clock.getAsLong();
        for (ChartStats stats : statsMap.values()) {
            boolean connected = stats.checker.isConnected();
            boolean stale = connected && isStale(stats.checker.getLastUpdateMillis(), now);
            stats.update(connected, stale, now);

            if (!connected) {
                LOGGER.warn("[HealthMonitor] chart {} is disconnected", stats.chart);
            } else if (stale) {
                LOGGER.warn("[HealthMonitor] chart {} has not updated for {} ms",
                    stats.chart, now - stats.checker.getLastUpdateMillis());
            }
        }
    }

    private boolean isStale(long lastUpdateMillis, long now) {
        return lastUpdateMillis > 0 && now - lastUpdateMillis > staleAfterMs;
    }

    /**
     * Returns whether every chart is connected and none is stale.
     */
    public boolean isHealthy() {
        for (ChartStats stats : statsMap.values()) {
            if (!stats.checker.isConnected() || stats.stale) {
                return false;
            }
        }
        return true;
    }

    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        for (ChartStats stats : statsMap.values()) {
            LOGGER.info("chart {}: connected={}, stale={}, updates={}, disconnectCount={}, lastDisconnect={}",
                stats.chart,
                stats.checker.isConnected(),
                stats.stale,
                stats.checker.getUpdateCount(),
                stats.disconnectCount,
                stats.lastDisconnectTime
            );
        }
        LOGGER.info("=============================");
    }

    public ChartStats getStats(int chart) {
        return statsMap.get(chart);
    }

    public Map<Integer, ChartStats> getAllStats() {
        return statsMap;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Live view of one chart pipeline.
     */
    public interface ChartChecker {
        boolean isConnected();
        long getLastUpdateMillis();
        long getUpdateCount();
    }

    /**
     * Statistics for a chart.
     */
    public static class ChartStats {
        private final int chart;
        private final ChartChecker checker;
        private volatile boolean stale = false;
        private volatile boolean wasConnected = true;
        private volatile long disconnectCount = 0;
        private volatile long lastDisconnectTime = 0;

        public ChartStats(int chart, ChartChecker checker) {
            this.chart = chart;
            this.checker = checker;
        }

        private void update(boolean connected, boolean stale, long now) {
            this.stale = stale;
            if (wasConnected && !connected) {
                disconnectCount++;
                lastDisconnectTime = now;
            }
            wasConnected = connected;
        }

        public int getChart() {
            return chart;
        }

        public boolean isConnected() {
            return checker.isConnected();
        }

        public boolean isStale() {
            return stale;
        }

        public long getDisconnectCount() {
            return disconnectCount;
        }

        public long getLastDisconnectTime() {
            return lastDisconnectTime;
        }

        public long getUpdateCount() {
            return checker.getUpdateCount();
        }

        public long getLastUpdateMillis() {
            return checker.getLastUpdateMillis();
        }
    }
}
