package io.trading.marketevent.engine.collector;

import io.trading.marketevent.api.StudySeries;
import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.LevelOverlaySettings;
import io.trading.marketevent.engine.LevelOverlaySettings.LevelStudy;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.SourceId;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Price levels published by studies on an overlay chart (gamma, blind spots, swing).
 *
 * Each subgraph is read at the overlay bar aligned with the source's latest bar;
 * a zero there falls back to the newest nonzero value of the subgraph.
 * Records are written under the overlay chart.
 */
public final class LevelsCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.LEVELS;
    }

    @Override
    public void collect(EmitContext ctx) {
        LevelOverlaySettings settings = ctx.config().levels();
        if (settings == null || !ctx.hasBars()) {
            return;
        }
        if (settings.newBarOnly() && !ctx.state().markLevelsBarTime(ctx.time())) {
            return;
        }

        SourceId overlay = settings.chart();
        OptionalInt aligned = ctx.aligner().alignIndex(overlay, ctx.time());
        if (aligned.isEmpty()) {
            ctx.diagnostic(EventType.LEVEL_DIAG, overlay, "no_data", ctx.lastIndex(), null);
            return;
        }
        for (LevelStudy study : settings.studies()) {
            for (int sg = 1; sg <= study.subgraphCount(); sg++) {
                exportLevel(ctx, overlay, study, sg, aligned.getAsInt());
            }
        }
    }

    private static void exportLevel(EmitContext ctx, SourceId overlay, LevelStudy study, int sg, int aligned) {
        Optional<StudySeries> series = ctx.data().studySeries(overlay, study.studyId(), sg);
        int bar = aligned;
        double value = 0.0;
        if (series.isPresent()) {
            StudySeries s = series.get();
            if (s.has(aligned)) {
                value = s.get(aligned);
            }
            if (!isSet(value)) {
                for (int k = s.size() - 1; k >= 0; k--) {
                    if (isSet(s.get(k))) {
                        value = s.get(k);
                        bar = k;
                        break;
                    }
                }
            }
        }

        NormalizedPrice price = isSet(value) ? ctx.price(overlay, value) : NormalizedPrice.invalid();
        if (!price.valid()) {
            ctx.diagnostic(EventType.LEVEL_DIAG, overlay, "no_value", "study" + study.studyId(), sg, b -> b
                .field("study", study.studyId())
                .field("sg", sg));
            return;
        }
        ctx.emitIfChanged(DedupKey.of(overlay, EventType.LEVEL, "study" + study.studyId(), sg),
            ctx.builder(EventType.LEVEL, overlay)
                .field("level_type", study.role().label(sg))
                .field("price", price.value())
                .field("subgraph", sg)
                .field("study_id", study.studyId())
                .field("bar", bar)
                .build());
    }

    private static boolean isSet(double value) {
        return value != 0.0 && Double.isFinite(value);
    }
}
