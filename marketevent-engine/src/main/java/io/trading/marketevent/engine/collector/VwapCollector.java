package io.trading.marketevent.engine.collector;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.api.StudySeries;
import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.EngineState;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.VwapSettings;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Session VWAP and its bands read from the chart's VWAP study.
 *
 * The study is resolved once per source, on the first update with bars: the
 * configured id first, then the known study names, keeping the first candidate
 * with a nonzero value at the latest bar. The outcome is reported once as a
 * {@code vwap_diag} carrying {@code resolved_id}.
 */
public final class VwapCollector implements EventCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(VwapCollector.class);

    @Override
    public Feature feature() {
        return Feature.VWAP;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        EngineState state = ctx.state();
        int index = ctx.lastIndex();
        if (!state.isVwapResolved()) {
            int resolved = resolve(ctx.data(), ctx.source(), index, ctx.config().vwap().studyId());
            state.setVwapStudyId(resolved);
            LOGGER.info("[{}] VWAP study resolved: {}", ctx.source(), resolved);
            ctx.diagnostic(EventType.VWAP_DIAG, ctx.source(), "resolved", index,
                b -> b.field("resolved_id", resolved));
        }

        int studyId = state.getVwapStudyId();
        if (studyId <= 0) {
            ctx.diagnostic(EventType.VWAP_DIAG, "study_not_found", index);
            return;
        }
        export(ctx, ctx.source(), index, studyId);
    }

    /**
     * Resolves the VWAP study of a chart.
     *
     * @return the study id, or {@link EngineState#STUDY_NOT_FOUND}
     */
    static int resolve(MarketDataSource data, SourceId chart, int index, int configuredId) {
        if (configuredId > 0 && hasValue(data, chart, configuredId, index)) {
            return configuredId;
        }
        for (String name : VwapSettings.STUDY_NAMES) {
            OptionalInt id = data.findStudyId(chart, name);
            if (id.isPresent() && id.getAsInt() > 0 && hasValue(data, chart, id.getAsInt(), index)) {
                return id.getAsInt();
            }
        }
        return EngineState.STUDY_NOT_FOUND;
    }

    /**
     * Looks a VWAP study up by name only, without checking its values.
     */
    static int findByName(MarketDataSource data, SourceId chart) {
        for (String name : VwapSettings.STUDY_NAMES) {
            OptionalInt id = data.findStudyId(chart, name);
            if (id.isPresent() && id.getAsInt() > 0) {
                return id.getAsInt();
            }
        }
        return EngineState.STUDY_NOT_FOUND;
    }

    private static boolean hasValue(MarketDataSource data, SourceId chart, int studyId, int index) {
        double sample = data.namedSeriesSample(chart, studyId, 0, index);
        return Double.isFinite(sample) && sample != 0.0;
    }

    /**
     * Exports the VWAP of a chart at a bar index.
     */
    void export(EmitContext ctx, SourceId chart, int index, int studyId) {
        MarketDataSource data = ctx.data();
        Optional<StudySeries> vwap = data.studySeries(chart, studyId, 0);
        if (vwap.isEmpty() || !vwap.get().has(index)) {
            ctx.diagnostic(EventType.VWAP_DIAG, chart, "array_too_small", index,
                b -> b.field("id", studyId).field("i", index));
            return;
        }
        NormalizedPrice value = ctx.price(chart, vwap.get().get(index));
        if (!value.valid()) {
            return;
        }

        EmittedEvent.Builder builder = ctx.builder(EventType.VWAP, chart)
            .field("src", "study")
            .field("i", index)
            .field("v", value.value());
        int bands = ctx.config().vwap().bandCount();
        for (int k = 1; k <= bands; k++) {
            NormalizedPrice up = ctx.price(chart, data.namedSeriesSample(chart, studyId, 2 * k - 1, index));
            NormalizedPrice dn = ctx.price(chart, data.namedSeriesSample(chart, studyId, 2 * k, index));
            if (up.valid()) {
                builder.field("up" + k, up.value());
            }
            if (dn.valid()) {
                builder.field("dn" + k, dn.value());
            }
        }
        ctx.emitIfChanged(DedupKey.of(chart, EventType.VWAP, index), builder.build());
    }
}
