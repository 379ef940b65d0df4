package io.trading.dumper.core;

import io.trading.dumper.metrics.DumperMetrics;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.engine.ChartEventEngine;
import io.trading.marketevent.model.RawUpdate;
import io.trading.marketevent.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Message loop of one chart: host notifications are queued and handed to the
 * chart's engine one at a time, in arrival order, on a dedicated thread.
 */
public class SourcePipeline implements AutoCloseable, HealthMonitor.ChartChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourcePipeline.class);

    private static final String STAGE_UPDATE = "update";

    private final ChartEventEngine engine;
    private final MarketDataSource data;
    private final DumperMetrics metrics;
    private final ProcessingTimer processingTimer;
    private final ExecutorService executor;
    private final AtomicLong updateCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);

    private volatile long lastUpdateMillis = 0;
    private volatile boolean closed = false;

    public SourcePipeline(ChartEventEngine engine, MarketDataSource data, DumperMetrics metrics,
                          ProcessingTimer processingTimer) {
        this.engine = engine;
        this.data = data;
        this.metrics = metrics;
        this.processingTimer = processingTimer;
        String threadName = "pipeline-chart-" + engine.getSource().chart();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queues a host notification.
     *
     * @return false if the pipeline is closed
     */
    public boolean submit(RawUpdate update) {
        if (closed) {
            rejected(update);
            return false;
        }
        try {
            executor.execute(() -> process(update));
            return true;
        } catch (RejectedExecutionException e) {
            rejected(update);
            return false;
        }
    }

    /**
     * Queues a notification stamped with the current time.
     */
    public boolean notifyUpdated() {
        return submit(new RawUpdate(engine.getSource(), System.currentTimeMillis()));
    }

    private void rejected(RawUpdate update) {
        rejectedCount.incrementAndGet();
        LOGGER.warn("[{}] Pipeline closed, dropping update received at {}", update.source(), update.receivedAtMillis());
    }

    private void process(RawUpdate update) {
        ProcessingTimer.TimingContext timer = processingTimer.start();
        SourceId source = engine.getSource();
        try {
            engine.onUpdate(update);
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Update failed: {}", source, e.getMessage(), e);
            metrics.onCollectorFailure(source, "pipeline");
        }
        long nanos = timer.stop();
        processingTimer.record(source.chart(), STAGE_UPDATE, nanos);
        metrics.recordUpdate(source, nanos / 1_000L);
        metrics.setConnected(source, isConnected());
        updateCount.incrementAndGet();
        lastUpdateMillis = update.receivedAtMillis();
    }

    /**
     * Waits until every update queued before this call has been processed.
     *
     * @return true if the queue drained within the timeout
     */
    public boolean awaitProcessed(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> marker;
        try {
            marker = executor.submit(() -> { });
        } catch (RejectedExecutionException e) {
            return executor.awaitTermination(timeout, unit);
        }
        try {
            marker.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("marker task failed", e);
        }
    }

    public SourceId getSource() {
        return engine.getSource();
    }

    public ChartEventEngine getEngine() {
        return engine;
    }

    @Override
    public boolean isConnected() {
        try {
            return data.isConnected(engine.getSource());
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Connection check failed: {}", engine.getSource(), e.getMessage());
            return false;
        }
    }

    @Override
    public long getLastUpdateMillis() {
        return lastUpdateMillis;
    }

    @Override
    public long getUpdateCount() {
        return updateCount.get();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("[{}] Pipeline did not drain, {} pending tasks dropped",
                    engine.getSource(), executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("[{}] Pipeline closed after {} updates", engine.getSource(), updateCount.get());
    }
}
