package io.trading.marketevent.engine.collector;

import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Exports bar, VWAP and order flow of coarser charts at the bar containing the
 * source's latest bar time. Records are written under the target chart and
 * deduplicated per target chart, type and bar.
 */
public final class CrossChartCollector implements EventCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrossChartCollector.class);

    private final BaseDataCollector baseData;
    private final VwapCollector vwap;
    private final OrderFlowCollector orderFlow;

    public CrossChartCollector(BaseDataCollector baseData, VwapCollector vwap, OrderFlowCollector orderFlow) {
        this.baseData = baseData;
        this.vwap = vwap;
        this.orderFlow = orderFlow;
    }

    @Override
    public Feature feature() {
        return Feature.CROSS_CHART;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        for (SourceId target : ctx.config().crossCharts()) {
            OptionalInt aligned = ctx.aligner().alignIndex(target, ctx.time());
            if (aligned.isEmpty()) {
                LOGGER.debug("[{}] No bar of {} contains {}", ctx.source(), target, ctx.time());
                continue;
            }
            int index = aligned.getAsInt();
            baseData.export(ctx, target, index, ctx.data().bar(target, index));

            int vwapId = VwapCollector.findByName(ctx.data(), target);
            if (vwapId > 0) {
                vwap.export(ctx, target, index, vwapId);
            } else {
                ctx.diagnostic(EventType.VWAP_DIAG, target, "study_not_found", index, null);
            }

            orderFlow.export(ctx, target, index, OrderFlowCollector.findStudy(ctx.data(), target));
        }
    }
}
