package io.trading.marketevent.session;

/**
 * Volume-weighted price accumulator.
 * Mean and variance are only defined once some volume has been added.
 */
public final class RunningStat {

    private double sumVolume;
    private double sumPriceVolume;
    private double sumPriceSquaredVolume;

    public void add(double price, double volume) {
        sumVolume += volume;
        sumPriceVolume += price * volume;
        sumPriceSquaredVolume += price * price * volume;
    }

    public boolean hasVolume() {
        return sumVolume > 0.0;
    }

    public double sumVolume() {
        return sumVolume;
    }

    public double sumPriceVolume() {
        return sumPriceVolume;
    }

    public double sumPriceSquaredVolume() {
        return sumPriceSquaredVolume;
    }

    /**
     * Volume-weighted mean price.
     *
     * @throws IllegalStateException if no volume was added
     */
    public double mean() {
        requireVolume();
        return sumPriceVolume / sumVolume;
    }

    /**
     * Volume-weighted variance, clamped at zero against rounding.
     */
    public double variance() {
        double mean = mean();
        return Math.max(0.0, sumPriceSquaredVolume / sumVolume - mean * mean);
    }

    public double sigma() {
        return Math.sqrt(variance());
    }

    private void requireVolume() {
        if (!hasVolume()) {
            throw new IllegalStateException("no volume accumulated");
        }
    }
}
