package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.IndexSettings;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;

import java.util.OptionalInt;

/**
 * Last value of an external index (e.g., VIX), taken from the aligned bar of
 * the index chart or from a study subgraph on the source chart.
 */
public final class IndexCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.INDEX;
    }

    @Override
    public void collect(EmitContext ctx) {
        IndexSettings settings = ctx.config().index();
        if (settings == null || !ctx.hasBars()) {
            return;
        }
        int index = ctx.lastIndex();
        NormalizedPrice value = read(ctx, settings, index);

        if (value.valid()) {
            ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.INDEX, index),
                ctx.builder(EventType.INDEX)
                    .field("i", index)
                    .field("last", value.value())
                    .field("mode", settings.mode().getCode())
                    .field("study", settings.studyId())
                    .field("sg", settings.subgraph())
                    .build());
        } else {
            ctx.diagnostic(EventType.INDEX_DIAG, ctx.source(), "no_data", index, b -> b
                .field("i", index)
                .field("mode", settings.mode().getCode())
                .field("study", settings.studyId())
                .field("sg", settings.subgraph()));
        }
    }

    private static NormalizedPrice read(EmitContext ctx, IndexSettings settings, int index) {
        return switch (settings.mode()) {
            case CHART -> {
                OptionalInt aligned = ctx.aligner().alignIndex(settings.chart(), ctx.time());
                yield aligned.isPresent()
                    ? ctx.price(settings.chart(), ctx.data().bar(settings.chart(), aligned.getAsInt()).close())
                    : NormalizedPrice.invalid();
            }
            case STUDY -> ctx.price(ctx.data().namedSeriesSample(ctx.source(), settings.studyId(), settings.subgraph(), index));
        };
    }
}
