package io.trading.marketevent.engine;

import io.trading.marketevent.align.CrossTimeframeAligner;
import io.trading.marketevent.api.EngineListener;
import io.trading.marketevent.api.EventSink;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.engine.collector.BarTradeCollector;
import io.trading.marketevent.engine.collector.BaseDataCollector;
import io.trading.marketevent.engine.collector.CrossChartCollector;
import io.trading.marketevent.engine.collector.DepthCollector;
import io.trading.marketevent.engine.collector.EventCollector;
import io.trading.marketevent.engine.collector.IndexCollector;
import io.trading.marketevent.engine.collector.LevelsCollector;
import io.trading.marketevent.engine.collector.OrderFlowCollector;
import io.trading.marketevent.engine.collector.PreviousSessionCollector;
import io.trading.marketevent.engine.collector.QuoteCollector;
import io.trading.marketevent.engine.collector.TimeAndSalesCollector;
import io.trading.marketevent.engine.collector.ValueAreaCollector;
import io.trading.marketevent.engine.collector.VwapCollector;
import io.trading.marketevent.model.RawUpdate;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.PriceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event pipeline of one source.
 *
 * Each update runs the enabled collectors in {@link Feature} order against a
 * snapshot of the source. A failing collector is logged and reported; the
 * others still run. Nothing runs while the source is disconnected.
 *
 * Not thread-safe: updates must be delivered one at a time, in order.
 */
public final class ChartEventEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChartEventEngine.class);

    private final SourceId source;
    private final MarketDataSource data;
    private final EngineConfig config;
    private final EventSink sink;
    private final EngineListener listener;
    private final EngineState state;
    private final PriceNormalizer normalizer;
    private final CrossTimeframeAligner aligner;
    private final List<EventCollector> collectors;

    public ChartEventEngine(SourceId source, MarketDataSource data, EngineConfig config,
                            EventSink sink, EngineListener listener) {
        if (source == null || data == null || config == null || sink == null) {
            throw new IllegalArgumentException("source, data, config and sink are required");
        }
        this.source = source;
        this.data = data;
        this.config = config;
        this.sink = sink;
        this.listener = listener != null ? listener : EngineListener.NOOP;
        this.state = new EngineState(source, sink, config.probeWindow());
        this.normalizer = new PriceNormalizer(config.normalizer());
        this.aligner = new CrossTimeframeAligner(data);
        this.collectors = createCollectors(config);

        LOGGER.info("[{}] Engine created with collectors {}", source, features());
    }

    private static List<EventCollector> createCollectors(EngineConfig config) {
        BaseDataCollector baseData = new BaseDataCollector();
        VwapCollector vwap = new VwapCollector();
        OrderFlowCollector orderFlow = new OrderFlowCollector();

        List<EventCollector> all = List.of(
            baseData,
            vwap,
            new ValueAreaCollector(),
            new PreviousSessionCollector(),
            new CrossChartCollector(baseData, vwap, orderFlow),
            new IndexCollector(),
            new LevelsCollector(),
            orderFlow,
            new QuoteCollector(),
            new BarTradeCollector(),
            new DepthCollector(),
            new TimeAndSalesCollector()
        );

        List<EventCollector> enabled = new ArrayList<>();
        for (EventCollector collector : all) {
            if (config.isEnabled(collector.feature())) {
                enabled.add(collector);
            }
        }
        return Collections.unmodifiableList(enabled);
    }

    /**
     * Handles one host notification to completion.
     */
    public void onUpdate(RawUpdate update) {
        if (update.source().chart() != source.chart()) {
            throw new IllegalArgumentException("Update for " + update.source() + " delivered to " + source);
        }
        if (!data.isConnected(source)) {
            LOGGER.debug("[{}] Source disconnected, skipping update", source);
            return;
        }
        state.incrementUpdateCount();

        EmitContext ctx;
        try {
            ctx = new EmitContext(data, config, state, normalizer, aligner, sink, listener, update);
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Failed to read source snapshot: {}", source, e.getMessage(), e);
            listener.onCollectorFailure(source, "snapshot");
            return;
        }

        for (EventCollector collector : collectors) {
            try {
                collector.collect(ctx);
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Collector {} failed: {}", source, collector.feature().getKey(), e.getMessage(), e);
                listener.onCollectorFailure(source, collector.feature().getKey());
            }
        }
    }

    public List<Feature> features() {
        List<Feature> features = new ArrayList<>(collectors.size());
        for (EventCollector collector : collectors) {
            features.add(collector.feature());
        }
        return features;
    }

    public SourceId getSource() {
        return source;
    }

    public EngineState getState() {
        return state;
    }

    public EngineConfig getConfig() {
        return config;
    }
}
