package io.trading.marketevent.align;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.model.SourceId;

import java.util.OptionalInt;

/**
 * Maps a timestamp of one chart to the bar of another chart that contains it.
 *
 * Bars of the target are assumed sorted by start time. The result is the last
 * bar starting at or before the timestamp; a timestamp newer than every bar
 * maps to the last bar. Never returns a future bar or an index out of range.
 */
public final class CrossTimeframeAligner {

    private final MarketDataSource data;

    public CrossTimeframeAligner(MarketDataSource data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        this.data = data;
    }

    /**
     * @param target          Chart to search
     * @param timestampMillis Time to locate
     * @return the containing bar index, or empty when the target has no bars or
     *         the timestamp precedes its first bar
     */
    public OptionalInt alignIndex(SourceId target, long timestampMillis) {
        int count = data.barCount(target);
        if (count <= 0) {
            return OptionalInt.empty();
        }
        if (data.bar(target, count - 1).timestampMillis() <= timestampMillis) {
            return OptionalInt.of(count - 1);
        }
        if (data.bar(target, 0).timestampMillis() > timestampMillis) {
            return OptionalInt.empty();
        }

        // invariant: bar(lo) <= t < bar(hi)
        int lo = 0;
        int hi = count - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (data.bar(target, mid).timestampMillis() <= timestampMillis) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return OptionalInt.of(lo);
    }
}
