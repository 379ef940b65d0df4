package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.SourceId;

/**
 * Latest bar OHLCV with bid/ask volume; dropped when any price fails normalization.
 */
public final class BaseDataCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.BASEDATA;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        export(ctx, ctx.source(), ctx.lastIndex(), ctx.lastBar());
    }

    /**
     * Exports one bar of any chart under that chart's identity.
     */
    void export(EmitContext ctx, SourceId chart, int index, Bar bar) {
        NormalizedPrice open = ctx.price(chart, bar.open());
        NormalizedPrice high = ctx.price(chart, bar.high());
        NormalizedPrice low = ctx.price(chart, bar.low());
        NormalizedPrice close = ctx.price(chart, bar.close());
        if (!open.valid() || !high.valid() || !low.valid() || !close.valid()) {
            return;
        }
        ctx.emitIfChanged(DedupKey.of(chart, EventType.BASEDATA, index),
            ctx.builder(EventType.BASEDATA, chart)
                .field("i", index)
                .field("o", open.value())
                .field("h", high.value())
                .field("l", low.value())
                .field("c", close.value())
                .field("v", (long) bar.volume())
                .field("bidvol", (long) bar.bidVolume())
                .field("askvol", (long) bar.askVolume())
                .build());
    }
}
