package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.BookSide;
import io.trading.marketevent.model.DepthEntry;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.Quote;

import java.util.Optional;

/**
 * Order book levels 1..N per side, each written when its price or size changed.
 * Level 1 takes price and size from the level 1 quote.
 */
public final class DepthCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.DEPTH;
    }

    @Override
    public void collect(EmitContext ctx) {
        Quote quote = ctx.data().bestQuote(ctx.source());
        int levels = ctx.config().maxDepthLevels();
        for (int level = 1; level <= levels; level++) {
            exportLevel(ctx, BookSide.BID, level, quote);
            exportLevel(ctx, BookSide.ASK, level, quote);
        }
    }

    private static void exportLevel(EmitContext ctx, BookSide side, int level, Quote quote) {
        Optional<DepthEntry> entry = ctx.data().depthLevel(ctx.source(), side, level);
        if (entry.isEmpty() || !entry.get().isPopulated()) {
            return;
        }
        double rawPrice = entry.get().price();
        long size = entry.get().size();
        if (level == 1 && quote != null) {
            rawPrice = side == BookSide.BID ? quote.bid() : quote.ask();
            size = side == BookSide.BID ? quote.bidSize() : quote.askSize();
        }
        NormalizedPrice price = ctx.price(rawPrice);
        if (!price.valid()) {
            return;
        }
        ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.DEPTH, side.name(), level),
            ctx.builder(EventType.DEPTH)
                .field("side", side.name())
                .field("lvl", level)
                .field("price", price.value())
                .field("size", size)
                .build());
    }
}
