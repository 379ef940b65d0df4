package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.Quote;
import io.trading.marketevent.model.TradeKind;
import io.trading.marketevent.normalize.PriceNormalizer;

/**
 * Level 1 quote with spread and mid, written only when price or size changed.
 */
public final class QuoteCollector implements EventCollector {

    private static final String LEVEL_ONE = "l1";

    @Override
    public Feature feature() {
        return Feature.QUOTES;
    }

    @Override
    public void collect(EmitContext ctx) {
        Quote quote = ctx.data().bestQuote(ctx.source());
        if (quote == null || quote.bid() <= 0.0 || quote.ask() <= 0.0) {
            return;
        }
        NormalizedPrice bid = ctx.price(quote.bid());
        NormalizedPrice ask = ctx.price(quote.ask());
        if (!bid.valid() || !ask.valid()) {
            return;
        }
        double tick = ctx.data().tickSize(ctx.source());
        ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.QUOTE, LEVEL_ONE, 0),
            ctx.builder(EventType.QUOTE)
                .field("kind", TradeKind.BIDASK.name())
                .field("bid", bid.value())
                .field("ask", ask.value())
                .field("bq", quote.bidSize())
                .field("aq", quote.askSize())
                .field("spread", PriceNormalizer.roundToTick(ask.value() - bid.value(), tick))
                .field("mid", (bid.value() + ask.value()) / 2.0)
                .build());
    }
}
