package io.trading.marketevent.engine.collector;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.api.StudySeries;
import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.EngineState;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.OrderFlowSettings;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.orderflow.OrderFlowMetrics;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Order-flow footprint, ratios and imbalance of a bar, from the order-flow study.
 * Ask and bid volume are required; trades and cumulative delta default to 0.
 */
public final class OrderFlowCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.ORDER_FLOW;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        OrderFlowSettings settings = ctx.config().orderFlow();
        int index = ctx.lastIndex();
        if (settings.newBarOnly() && !ctx.state().markOrderFlowBar(index)) {
            return;
        }
        int studyId = settings.studyId() > 0 ? settings.studyId() : findStudy(ctx.data(), ctx.source());
        export(ctx, ctx.source(), index, studyId);
    }

    static int findStudy(MarketDataSource data, SourceId chart) {
        OptionalInt id = data.findStudyId(chart, OrderFlowSettings.STUDY_NAME);
        return id.isPresent() && id.getAsInt() > 0 ? id.getAsInt() : EngineState.STUDY_NOT_FOUND;
    }

    /**
     * Exports the order flow of a chart at a bar index.
     */
    void export(EmitContext ctx, SourceId chart, int index, int studyId) {
        if (studyId <= 0) {
            ctx.diagnostic(EventType.ORDER_FLOW_DIAG, chart, "study_not_found", index, b -> b.field("i", index));
            return;
        }
        MarketDataSource data = ctx.data();
        OrderFlowSettings settings = ctx.config().orderFlow();
        Optional<StudySeries> ask = data.studySeries(chart, studyId, settings.askSubgraph());
        Optional<StudySeries> bid = data.studySeries(chart, studyId, settings.bidSubgraph());
        Optional<StudySeries> delta = data.studySeries(chart, studyId, settings.deltaSubgraph());
        Optional<StudySeries> trades = data.studySeries(chart, studyId, settings.tradesSubgraph());
        Optional<StudySeries> cumulative = data.studySeries(chart, studyId, settings.cumulativeDeltaSubgraph());

        if (!has(ask, index) || !has(bid, index)) {
            ctx.diagnostic(EventType.ORDER_FLOW_DIAG, chart, "insufficient_data", index, b -> b
                .field("i", index)
                .field("ask_sz", size(ask))
                .field("bid_sz", size(bid))
                .field("delta_sz", size(delta))
                .field("trades_sz", size(trades))
                .field("cum_sz", size(cumulative)));
            return;
        }

        OrderFlowMetrics metrics = new OrderFlowMetrics(
            ask.get().get(index),
            bid.get().get(index),
            has(trades, index) ? trades.get().get(index) : 0.0,
            has(cumulative, index) ? cumulative.get().get(index) : 0.0);

        ctx.emitIfChanged(DedupKey.of(chart, EventType.ORDER_FLOW_FOOTPRINT, index),
            ctx.builder(EventType.ORDER_FLOW_FOOTPRINT, chart)
                .field("i", index)
                .field("ask_volume", Math.round(metrics.askVolume()))
                .field("bid_volume", Math.round(metrics.bidVolume()))
                .field("delta", Math.round(metrics.delta()))
                .field("trades", Math.round(metrics.trades()))
                .field("cumulative_delta", Math.round(metrics.cumulativeDelta()))
                .field("total_volume", Math.round(metrics.totalVolume()))
                .build());

        ctx.emitIfChanged(DedupKey.of(chart, EventType.ORDER_FLOW_METRICS, index),
            ctx.builder(EventType.ORDER_FLOW_METRICS, chart)
                .field("i", index)
                .field("delta_ratio", metrics.deltaRatio())
                .field("bid_ask_ratio", metrics.bidAskRatio())
                .field("ask_bid_ratio", metrics.askBidRatio())
                .field("pressure_bullish", metrics.isBullish() ? 1 : 0)
                .field("pressure_bearish", metrics.isBearish() ? 1 : 0)
                .build());

        ctx.emitIfChanged(DedupKey.of(chart, EventType.ORDER_FLOW_IMBALANCE, index),
            ctx.builder(EventType.ORDER_FLOW_IMBALANCE, chart)
                .field("i", index)
                .field("volume_imbalance", metrics.volumeImbalance())
                .field("trade_intensity", metrics.tradeIntensity())
                .field("delta_trend", metrics.deltaTrend())
                .field("absorption_pattern", metrics.isAbsorption() ? 1 : 0)
                .build());
    }

    private static boolean has(Optional<StudySeries> series, int index) {
        return series.isPresent() && series.get().has(index);
    }

    private static int size(Optional<StudySeries> series) {
        return series.map(StudySeries::size).orElse(0);
    }
}
