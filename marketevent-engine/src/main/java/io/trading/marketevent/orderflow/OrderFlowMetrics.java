package io.trading.marketevent.orderflow;

/**
 * Per-bar order-flow figures derived from ask/bid volume.
 *
 * Delta is always ask minus bid volume, whatever the host's delta subgraph says.
 * Ratios are 0 when their denominator is 0.
 *
 * @param askVolume       Volume traded at the ask
 * @param bidVolume       Volume traded at the bid
 * @param trades          Number of trades, 0 when unknown
 * @param cumulativeDelta Cumulative delta of the day, 0 when unknown
 */
public record OrderFlowMetrics(
    double askVolume,
    double bidVolume,
    double trades,
    double cumulativeDelta
) {
    /**
     * Share of volume the delta must exceed to count as absorption.
     */
    public static final double ABSORPTION_SHARE = 0.10;

    public double delta() {
        return askVolume - bidVolume;
    }

    public double totalVolume() {
        return askVolume + bidVolume;
    }

    public double deltaRatio() {
        double total = totalVolume();
        return total > 0.0 ? delta() / total : 0.0;
    }

    public double bidAskRatio() {
        return askVolume > 0.0 ? bidVolume / askVolume : 0.0;
    }

    public double askBidRatio() {
        return bidVolume > 0.0 ? askVolume / bidVolume : 0.0;
    }

    public boolean isBullish() {
        return delta() > 0.0;
    }

    public boolean isBearish() {
        return delta() < 0.0;
    }

    /**
     * Large one-sided volume: |delta| above 10% of the total.
     */
    public boolean isAbsorption() {
        double total = totalVolume();
        return total > 0.0 && Math.abs(delta()) > ABSORPTION_SHARE * total;
    }

    /**
     * Sign of the cumulative delta: 1, -1 or 0.
     */
    public int deltaTrend() {
        return (int) Math.signum(cumulativeDelta);
    }

    public double volumeImbalance() {
        return deltaRatio();
    }

    public double tradeIntensity() {
        double total = totalVolume();
        return total > 0.0 ? trades / total : 0.0;
    }
}
