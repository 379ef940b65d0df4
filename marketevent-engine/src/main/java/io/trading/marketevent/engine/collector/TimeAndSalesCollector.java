package io.trading.marketevent.engine.collector;

import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.TimeAndSalesRecord;
import io.trading.marketevent.replay.PollResult;
import io.trading.marketevent.replay.ReplayCursor;

import java.util.List;

/**
 * Replays new time and sales records: quote kinds become {@code quote} records,
 * everything else {@code trade} records, each stamped with its own time and sequence.
 */
public final class TimeAndSalesCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.TIME_AND_SALES;
    }

    @Override
    public void collect(EmitContext ctx) {
        List<TimeAndSalesRecord> log = ctx.data().timeAndSales(ctx.source());
        ReplayCursor<TimeAndSalesRecord> cursor = ctx.state().getCursor();
        PollResult<TimeAndSalesRecord> result = cursor.poll(log);

        if (result.reset()) {
            ctx.listener().onCursorReset(ctx.source());
            ctx.diagnosticAlways(EmittedEvent.builder(EventType.TIME_AND_SALES_DIAG, ctx.source(), ctx.time())
                .field("msg", "cursor_reset")
                .field("strategy", cursor.getStrategy().name())
                .field("size", log.size())
                .build());
        }
        for (TimeAndSalesRecord record : result.records()) {
            if (record.kind().isQuote()) {
                emitQuote(ctx, record);
            } else {
                emitTrade(ctx, record);
            }
        }
    }

    private static void emitQuote(EmitContext ctx, TimeAndSalesRecord record) {
        if (record.bid() <= 0.0 || record.ask() <= 0.0) {
            return;
        }
        NormalizedPrice bid = ctx.price(record.bid());
        NormalizedPrice ask = ctx.price(record.ask());
        if (!bid.valid() || !ask.valid()) {
            return;
        }
        ctx.emit(EmittedEvent.builder(EventType.QUOTE, ctx.source(), record.timestampMillis())
            .field("kind", record.kind().name())
            .field("bid", bid.value())
            .field("ask", ask.value())
            .field("bq", record.bidSize())
            .field("aq", record.askSize())
            .field("seq", record.sequence())
            .build());
    }

    private static void emitTrade(EmitContext ctx, TimeAndSalesRecord record) {
        if (record.price() <= 0.0 || record.volume() <= 0) {
            return;
        }
        NormalizedPrice px = ctx.price(record.price());
        if (!px.valid()) {
            return;
        }
        ctx.emit(EmittedEvent.builder(EventType.TRADE, ctx.source(), record.timestampMillis())
            .field("px", px.value())
            .field("vol", record.volume())
            .field("seq", record.sequence())
            .build());
    }
}
