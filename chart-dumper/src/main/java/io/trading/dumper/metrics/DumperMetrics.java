package io.trading.dumper.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.marketevent.api.EngineListener;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;

/**
 * Prometheus metrics collector for the Chart Dumper.
 *
 * Tracks:
 * - Records emitted and suppressed per chart and type
 * - Diagnostics per chart, type and message
 * - Invalid prices, cursor resets, collector and write failures
 * - Live mirror publication failures
 * - Update processing latency and connection status
 *
 * Receives engine callbacks on pipeline threads; Prometheus children are thread-safe.
 */
public class DumperMetrics implements EngineListener {

    private final CollectorRegistry registry;

    // Counters
    private final Counter eventsEmitted;
    private final Counter eventsSuppressed;
    private final Counter diagnostics;
    private final Counter invalidPrices;
    private final Counter cursorResets;
    private final Counter collectorFailures;
    private final Counter writeFailures;
    private final Counter livePublishFailures;

    // Gauges
    private final Gauge connectionStatus;

    // Summary (latency tracking)
    private final Summary updateLatency;

    /**
     * Registers into the default registry, with JVM metrics.
     */
    public DumperMetrics() {
        this(CollectorRegistry.defaultRegistry);
        // GC, memory, threads, etc.
        DefaultExports.initialize();
    }

    /**
     * Registers into the given registry, without JVM metrics.
     */
    public DumperMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsEmitted = Counter.build()
            .name("dumper_events_emitted_total")
            .help("Total number of records written to the event log")
            .labelNames("chart", "type")
            .register(registry);

        this.eventsSuppressed = Counter.build()
            .name("dumper_events_suppressed_total")
            .help("Total number of records suppressed because their value did not change")
            .labelNames("chart", "type")
            .register(registry);

        this.diagnostics = Counter.build()
            .name("dumper_diagnostics_total")
            .help("Total number of diagnostic records written")
            .labelNames("chart", "type", "msg")
            .register(registry);

        this.invalidPrices = Counter.build()
            .name("dumper_invalid_prices_total")
            .help("Total number of prices dropped by normalization")
            .labelNames("chart")
            .register(registry);

        this.cursorResets = Counter.build()
            .name("dumper_cursor_resets_total")
            .help("Total number of time and sales cursor resets")
            .labelNames("chart")
            .register(registry);

        this.collectorFailures = Counter.build()
            .name("dumper_collector_failures_total")
            .help("Total number of collector exceptions")
            .labelNames("chart", "collector")
            .register(registry);

        this.writeFailures = Counter.build()
            .name("dumper_write_failures_total")
            .help("Total number of records lost to event log I/O failures")
            .labelNames("chart", "type")
            .register(registry);

        this.livePublishFailures = Counter.build()
            .name("dumper_live_publish_failures_total")
            .help("Total number of lines the Aeron live mirror could not publish")
            .labelNames("chart")
            .register(registry);

        // 1 = connected, 0 = disconnected
        this.connectionStatus = Gauge.build()
            .name("dumper_source_connected")
            .help("Host connection status per chart (1 = connected, 0 = disconnected)")
            .labelNames("chart")
            .register(registry);

        this.updateLatency = Summary.build()
            .name("dumper_update_latency_microseconds")
            .help("Processing time of one host update in microseconds")
            .labelNames("chart")
            .register(registry);
    }

    private static String chart(SourceId source) {
        return Integer.toString(source.chart());
    }

    @Override
    public void onEmitted(SourceId source, EventType type) {
        eventsEmitted.labels(chart(source), type.getTag()).inc();
    }

    @Override
    public void onSuppressed(SourceId source, EventType type) {
        eventsSuppressed.labels(chart(source), type.getTag()).inc();
    }

    @Override
    public void onDiagnostic(SourceId source, EventType type, String msg) {
        diagnostics.labels(chart(source), type.getTag(), msg != null ? msg : "").inc();
    }

    @Override
    public void onInvalidPrice(SourceId source) {
        invalidPrices.labels(chart(source)).inc();
    }

    @Override
    public void onCursorReset(SourceId source) {
        cursorResets.labels(chart(source)).inc();
    }

    @Override
    public void onCollectorFailure(SourceId source, String collector) {
        collectorFailures.labels(chart(source), collector).inc();
    }

    @Override
    public void onWriteFailure(SourceId source, EventType type) {
        writeFailures.labels(chart(source), type.getTag()).inc();
    }

    public void recordLivePublishFailure(SourceId source) {
        livePublishFailures.labels(chart(source)).inc();
    }

    public void setConnected(SourceId source, boolean connected) {
        connectionStatus.labels(chart(source)).set(connected ? 1 : 0);
    }

    /**
     * Records the processing time of one update.
     */
    public void recordUpdate(SourceId source, double latencyMicros) {
        updateLatency.labels(chart(source)).observe(latencyMicros);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getEventsEmitted(SourceId source, EventType type) {
        return eventsEmitted.labels(chart(source), type.getTag()).get();
    }

    public double getEventsSuppressed(SourceId source, EventType type) {
        return eventsSuppressed.labels(chart(source), type.getTag()).get();
    }

    public double getDiagnostics(SourceId source, EventType type, String msg) {
        return diagnostics.labels(chart(source), type.getTag(), msg).get();
    }

    public double getInvalidPrices(SourceId source) {
        return invalidPrices.labels(chart(source)).get();
    }

    public double getCollectorFailures(SourceId source, String collector) {
        return collectorFailures.labels(chart(source), collector).get();
    }

    public double getWriteFailures(SourceId source, EventType type) {
        return writeFailures.labels(chart(source), type.getTag()).get();
    }

    public double getLivePublishFailures(SourceId source) {
        return livePublishFailures.labels(chart(source)).get();
    }

    /**
     * Total records emitted for a chart across all types.
     * Reads the registry, so types never seen do not get a zero series.
     */
    public long getTotalEmitted(SourceId source) {
        long total = 0;
        for (EventType type : EventType.values()) {
            Double value = registry.getSampleValue("dumper_events_emitted_total",
                new String[]{"chart", "type"}, new String[]{chart(source), type.getTag()});
            if (value != null) {
                total += value.longValue();
            }
        }
        return total;
    }

    public long getUpdateCount(SourceId source) {
        return (long) updateLatency.labels(chart(source)).get().count;
    }
}
