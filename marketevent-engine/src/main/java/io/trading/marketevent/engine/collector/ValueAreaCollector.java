package io.trading.marketevent.engine.collector;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.ValueAreaSettings;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.session.SessionStatsAggregator;
import io.trading.marketevent.session.SessionWindow;
import io.trading.marketevent.session.ValueArea;
import io.trading.marketevent.session.ValueAreaCalculator;

import java.util.Optional;

/**
 * Value area (POC, VAH, VAL) of the current and previous session.
 *
 * Read from value-area studies when ids are configured (subgraph 1 = POC,
 * 2 = VAH, 3 = VAL), otherwise computed from volume-at-price.
 */
public final class ValueAreaCollector implements EventCollector {

    private static final int POC_SUBGRAPH = 1;
    private static final int VAH_SUBGRAPH = 2;
    private static final int VAL_SUBGRAPH = 3;

    @Override
    public Feature feature() {
        return Feature.VALUE_AREA;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        ValueAreaSettings settings = ctx.config().valueArea();
        int index = ctx.lastIndex();
        if (settings.newBarOnly() && !ctx.state().markValueAreaBar(index)) {
            return;
        }

        EmittedEvent.Builder builder = ctx.builder(EventType.VALUE_AREA).field("i", index);
        boolean any;
        if (settings.usesStudies()) {
            builder.field("src", "study");
            any = readStudy(ctx, settings.currentStudyId(), index, builder, "vah", "val", "vpoc");
            any |= readStudy(ctx, settings.previousStudyId(), index, builder, "pvah", "pval", "ppoc");
            builder.field("id_curr", settings.currentStudyId()).field("id_prev", settings.previousStudyId());
            if (!any) {
                boolean exists = studyExists(ctx, settings.currentStudyId()) || studyExists(ctx, settings.previousStudyId());
                ctx.diagnostic(EventType.VALUE_AREA_DIAG, exists ? "array_too_small" : "study_not_found", index);
                return;
            }
        } else {
            builder.field("src", "vap");
            any = computeFromProfile(ctx, index, builder);
            if (!any) {
                ctx.diagnostic(EventType.VALUE_AREA_DIAG, "no_volume", index);
                return;
            }
        }
        ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.VALUE_AREA, index), builder.build());
    }

    private static boolean studyExists(EmitContext ctx, int studyId) {
        return studyId > 0 && ctx.data().studySeries(ctx.source(), studyId, POC_SUBGRAPH).isPresent();
    }

    /**
     * Reads one value-area study into high/low/poc fields; VAL and VAH are swapped when inverted.
     */
    private static boolean readStudy(EmitContext ctx, int studyId, int index, EmittedEvent.Builder builder,
                                     String highField, String lowField, String pocField) {
        if (studyId <= 0) {
            return false;
        }
        MarketDataSource data = ctx.data();
        SourceId source = ctx.source();
        NormalizedPrice poc = ctx.price(data.namedSeriesSample(source, studyId, POC_SUBGRAPH, index));
        NormalizedPrice vah = ctx.price(data.namedSeriesSample(source, studyId, VAH_SUBGRAPH, index));
        NormalizedPrice val = ctx.price(data.namedSeriesSample(source, studyId, VAL_SUBGRAPH, index));
        if (vah.valid() && val.valid() && val.value() > vah.value()) {
            NormalizedPrice tmp = vah;
            vah = val;
            val = tmp;
        }
        if (vah.valid()) {
            builder.field(highField, vah.value());
        }
        if (val.valid()) {
            builder.field(lowField, val.value());
        }
        if (poc.valid()) {
            builder.field(pocField, poc.value());
        }
        return vah.valid() || val.valid() || poc.valid();
    }

    private static boolean computeFromProfile(EmitContext ctx, int index, EmittedEvent.Builder builder) {
        MarketDataSource data = ctx.data();
        SourceId source = ctx.source();
        ValueAreaCalculator calculator = new ValueAreaCalculator(ctx.normalizer(), ctx.config().valueArea().share());
        boolean any = false;

        SessionWindow current = SessionStatsAggregator.findCurrentSession(data, source, index);
        if (current != null) {
            Optional<ValueArea> area = calculator.compute(data, source, current);
            if (area.isPresent()) {
                builder.field("vah", area.get().vah()).field("val", area.get().val()).field("vpoc", area.get().poc());
                any = true;
            }
        }
        SessionWindow previous = SessionStatsAggregator.findPreviousSession(data, source, index);
        if (previous != null) {
            Optional<ValueArea> area = calculator.compute(data, source, previous);
            if (area.isPresent()) {
                builder.field("pvah", area.get().vah()).field("pval", area.get().val()).field("ppoc", area.get().poc());
                any = true;
            }
        }
        return any;
    }
}
