package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;

/**
 * Last trade derived from the latest bar, written whenever its close or volume moves.
 */
public final class BarTradeCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.TRADES;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        Bar bar = ctx.lastBar();
        long volume = (long) bar.volume();
        if (bar.close() <= 0.0 || volume <= 0) {
            return;
        }
        NormalizedPrice price = ctx.price(bar.close());
        if (!price.valid()) {
            return;
        }
        ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.TRADE, "bar", ctx.lastIndex()),
            ctx.builder(EventType.TRADE)
                .field("source", "basedata")
                .field("px", price.value())
                .field("qty", volume)
                .build());
    }
}
