package io.trading.marketevent.session;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.PriceVolume;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.PriceNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes volume-weighted mean, deviation and bands of the session before the
 * one containing a given bar, from the bars' volume-at-price data.
 *
 * Stateless; gating on new bars is the caller's concern.
 */
public final class SessionStatsAggregator {

    public static final double[] BAND_MULTIPLIERS = {0.5, 1.0, 1.5, 2.0};

    private final PriceNormalizer normalizer;
    private final int bandCount;

    public SessionStatsAggregator(PriceNormalizer normalizer, int bandCount) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (bandCount < 0 || bandCount > BAND_MULTIPLIERS.length) {
            throw new IllegalArgumentException("bandCount must be between 0 and " + BAND_MULTIPLIERS.length);
        }
        this.normalizer = normalizer;
        this.bandCount = bandCount;
    }

    public SessionStatsResult computePreviousSessionStats(MarketDataSource data, SourceId source, int currentBar) {
        SessionWindow window = findPreviousSession(data, source, currentBar);
        if (window == null) {
            return SessionStatsResult.insufficientHistory();
        }

        double tick = data.tickSize(source);
        double multiplier = data.realTimeMultiplier(source);
        RunningStat stat = new RunningStat();
        int dropped = 0;
        for (int i = window.startIndex(); i <= window.endIndex(); i++) {
            for (PriceVolume pv : data.volumeAtPrice(source, i)) {
                if (!(pv.volume() > 0.0)) {
                    continue;
                }
                NormalizedPrice price = normalizer.normalize(pv.price(), tick, multiplier);
                if (!price.valid()) {
                    dropped++;
                    continue;
                }
                stat.add(price.value(), pv.volume());
            }
        }
        if (!stat.hasVolume()) {
            return SessionStatsResult.noVolume(dropped);
        }

        double mean = stat.mean();
        double sigma = stat.sigma();

        NormalizedPrice reference = normalizer.normalize(data.bar(source, currentBar).close(), tick, multiplier);
        if (reference.valid()) {
            double aligned = PriceNormalizer.alignToReference(mean, reference.value());
            if (aligned != mean) {
                // one factor for both, so the bands keep their shape
                double factor = aligned / mean;
                mean = aligned;
                sigma *= factor;
            }
        }

        return SessionStatsResult.ok(
            new SessionStats(window, mean, sigma, stat.sumVolume(), buildBands(mean, sigma)), dropped);
    }

    /**
     * Locates the session preceding the one that contains {@code currentBar}.
     *
     * @return the window, or null when the current session starts at bar 0 or the index is out of range
     */
    public static SessionWindow findPreviousSession(MarketDataSource data, SourceId source, int currentBar) {
        SessionWindow current = findCurrentSession(data, source, currentBar);
        if (current == null) {
            return null;
        }
        int currStart = current.startIndex();
        if (currStart <= 0) {
            return null;
        }
        int prevEnd = currStart - 1;
        int prevStart = prevEnd;
        while (prevStart > 0 && !data.isSessionStart(source, prevStart)) {
            prevStart--;
        }
        return new SessionWindow(prevStart, prevEnd);
    }

    /**
     * Session containing {@code currentBar}, from its first bar up to {@code currentBar}.
     *
     * @return the window, or null when the index is out of range
     */
    public static SessionWindow findCurrentSession(MarketDataSource data, SourceId source, int currentBar) {
        if (currentBar < 0 || currentBar >= data.barCount(source)) {
            return null;
        }
        int currStart = currentBar;
        while (currStart > 0 && !data.isSessionStart(source, currStart)) {
            currStart--;
        }
        return new SessionWindow(currStart, currentBar);
    }

    private List<SessionStats.Band> buildBands(double mean, double sigma) {
        List<SessionStats.Band> bands = new ArrayList<>(bandCount);
        for (int i = 0; i < bandCount; i++) {
            double k = BAND_MULTIPLIERS[i];
            bands.add(new SessionStats.Band(i + 1, k, mean + k * sigma, mean - k * sigma));
        }
        return bands;
    }

    public int getBandCount() {
        return bandCount;
    }
}
