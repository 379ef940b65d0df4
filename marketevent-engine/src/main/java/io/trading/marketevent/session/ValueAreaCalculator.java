package io.trading.marketevent.session;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.PriceVolume;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.PriceNormalizer;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds a value area from volume-at-price samples.
 *
 * Starting at the point of control, the area grows one price level at a time
 * towards the heavier neighbour (downwards on ties) until the configured share
 * of the total volume is covered.
 */
public final class ValueAreaCalculator {

    public static final double DEFAULT_VALUE_AREA_SHARE = 0.70;

    private final PriceNormalizer normalizer;
    private final double valueAreaShare;

    public ValueAreaCalculator(PriceNormalizer normalizer, double valueAreaShare) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (!(valueAreaShare > 0.0 && valueAreaShare <= 1.0)) {
            throw new IllegalArgumentException("valueAreaShare must be in (0, 1]");
        }
        this.normalizer = normalizer;
        this.valueAreaShare = valueAreaShare;
    }

    /**
     * Value area of the bars {@code [window.startIndex, window.endIndex]}.
     */
    public Optional<ValueArea> compute(MarketDataSource data, SourceId source, SessionWindow window) {
        double tick = data.tickSize(source);
        double multiplier = data.realTimeMultiplier(source);
        TreeMap<Double, Double> profile = new TreeMap<>();
        for (int i = window.startIndex(); i <= window.endIndex(); i++) {
            for (PriceVolume pv : data.volumeAtPrice(source, i)) {
                if (!(pv.volume() > 0.0)) {
                    continue;
                }
                NormalizedPrice price = normalizer.normalize(pv.price(), tick, multiplier);
                if (price.valid()) {
                    profile.merge(price.value(), pv.volume(), Double::sum);
                }
            }
        }
        return fromProfile(profile, valueAreaShare);
    }

    /**
     * Value area of an already aggregated price-to-volume profile.
     */
    public static Optional<ValueArea> fromProfile(TreeMap<Double, Double> profile, double valueAreaShare) {
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        int n = profile.size();
        double[] prices = new double[n];
        double[] volumes = new double[n];
        double total = 0.0;
        int i = 0;
        for (Map.Entry<Double, Double> e : profile.entrySet()) {
            prices[i] = e.getKey();
            volumes[i] = e.getValue();
            total += volumes[i];
            i++;
        }
        if (!(total > 0.0)) {
            return Optional.empty();
        }

        int pocIdx = 0;
        for (int j = 1; j < n; j++) {
            if (volumes[j] > volumes[pocIdx]) {
                pocIdx = j;
            }
        }

        double target = total * valueAreaShare;
        int left = pocIdx;
        int right = pocIdx;
        double covered = volumes[pocIdx];
        while (covered < target && (left > 0 || right < n - 1)) {
            double leftNext = left > 0 ? volumes[left - 1] : -1.0;
            double rightNext = right < n - 1 ? volumes[right + 1] : -1.0;
            if (left > 0 && leftNext >= rightNext) {
                left--;
                covered += volumes[left];
            } else {
                right++;
                covered += volumes[right];
            }
        }
        return Optional.of(new ValueArea(prices[pocIdx], prices[right], prices[left], total));
    }

    public double getValueAreaShare() {
        return valueAreaShare;
    }
}
