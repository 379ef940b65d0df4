package io.trading.marketevent.engine.collector;

import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.engine.SessionStatsSettings;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.session.SessionStats;
import io.trading.marketevent.session.SessionStatsAggregator;
import io.trading.marketevent.session.SessionStatsResult;
import io.trading.marketevent.session.SessionWindow;

/**
 * Previous-session VWAP with sigma bands, from volume-at-price.
 */
public final class PreviousSessionCollector implements EventCollector {

    @Override
    public Feature feature() {
        return Feature.PREVIOUS_SESSION;
    }

    @Override
    public void collect(EmitContext ctx) {
        if (!ctx.hasBars()) {
            return;
        }
        SessionStatsSettings settings = ctx.config().sessionStats();
        int index = ctx.lastIndex();
        if (settings.newBarOnly() && !ctx.state().markSessionStatsBar(index)) {
            return;
        }

        SessionStatsAggregator aggregator = new SessionStatsAggregator(ctx.normalizer(), settings.bandCount());
        SessionStatsResult result = aggregator.computePreviousSessionStats(ctx.data(), ctx.source(), index);
        ctx.reportInvalidPrices(ctx.source(), result.droppedSamples());
        switch (result.status()) {
            case INSUFFICIENT_HISTORY -> ctx.diagnostic(EventType.PREVIOUS_SESSION_DIAG, ctx.source(),
                result.status().getDiagnostic(), index, null);
            case NO_VOLUME -> {
                SessionWindow window = SessionStatsAggregator.findPreviousSession(ctx.data(), ctx.source(), index);
                ctx.diagnostic(EventType.PREVIOUS_SESSION_DIAG, ctx.source(), result.status().getDiagnostic(), index,
                    b -> b.field("prev_start", window.startIndex()).field("prev_end", window.endIndex()));
            }
            case OK -> emitStats(ctx, index, result.stats());
        }
    }

    private static void emitStats(EmitContext ctx, int index, SessionStats stats) {
        EmittedEvent.Builder builder = ctx.builder(EventType.PREVIOUS_SESSION)
            .field("i", index)
            .field("prev_start", stats.window().startIndex())
            .field("prev_end", stats.window().endIndex())
            .field("pvwap", stats.mean())
            .field("sigma", stats.sigma());
        for (SessionStats.Band band : stats.bands()) {
            builder.field("up" + band.level(), band.upper());
            builder.field("dn" + band.level(), band.lower());
        }
        ctx.emitIfChanged(DedupKey.of(ctx.source(), EventType.PREVIOUS_SESSION, index), builder.build());
    }
}
