package io.trading.marketevent.api;

import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.BookSide;
import io.trading.marketevent.model.DepthEntry;
import io.trading.marketevent.model.PriceVolume;
import io.trading.marketevent.model.Quote;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.model.TimeAndSalesRecord;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Pull-based view of the charting host.
 * All reads for one chart happen on that chart's pipeline thread; implementations
 * shared across charts must be safe for concurrent reads of different charts.
 */
public interface MarketDataSource {

    /**
     * Returns whether the host is currently connected to its data feed.
     */
    boolean isConnected(SourceId source);

    /**
     * Number of bars currently loaded for the chart.
     */
    int barCount(SourceId source);

    /**
     * Returns the bar at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is outside [0, barCount)
     */
    Bar bar(SourceId source, int index);

    /**
     * Returns the latest bar, or empty when the chart has no bars yet.
     */
    default Optional<Bar> latestBar(SourceId source) {
        int count = barCount(source);
        return count > 0 ? Optional.of(bar(source, count - 1)) : Optional.empty();
    }

    /**
     * Returns whether the bar at the given index opens a new trading session.
     */
    boolean isSessionStart(SourceId source, int index);

    /**
     * Volume-at-price elements of the bar at the given index.
     * Empty when the host does not maintain volume-at-price data.
     */
    List<PriceVolume> volumeAtPrice(SourceId source, int index);

    /**
     * Current level 1 quote.
     */
    Quote bestQuote(SourceId source);

    /**
     * Order book entry at a 1-based level, or empty when the level is not available.
     */
    Optional<DepthEntry> depthLevel(SourceId source, BookSide side, int level);

    /**
     * Resolves a study on the chart by its display name.
     */
    OptionalInt findStudyId(SourceId source, String studyName);

    /**
     * Returns a subgraph array of a study, or empty when the study does not exist.
     */
    Optional<StudySeries> studySeries(SourceId source, int studyId, int subgraph);

    /**
     * Returns one sample of a study subgraph, or NaN when the study or the index is missing.
     */
    default double namedSeriesSample(SourceId source, int studyId, int subgraph, int barIndex) {
        return studySeries(source, studyId, subgraph)
            .filter(series -> series.has(barIndex))
            .map(series -> series.get(barIndex))
            .orElse(Double.NaN);
    }

    /**
     * Snapshot of the append-only time and sales log, oldest first.
     */
    List<TimeAndSalesRecord> timeAndSales(SourceId source);

    /**
     * Smallest valid price increment of the chart's instrument.
     */
    double tickSize(SourceId source);

    /**
     * Real-time price multiplier configured on the chart; 0 when unset.
     */
    double realTimeMultiplier(SourceId source);
}
