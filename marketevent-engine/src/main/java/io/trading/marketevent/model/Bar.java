package io.trading.marketevent.model;

/**
 * One OHLCV bar as delivered by the charting host, prices not yet normalized.
 *
 * @param open            Open price
 * @param high            High price
 * @param low             Low price
 * @param close           Last price
 * @param volume          Total volume
 * @param bidVolume       Volume traded at the bid
 * @param askVolume       Volume traded at the ask
 * @param timestampMillis Bar start time in epoch milliseconds
 */
public record Bar(
    double open,
    double high,
    double low,
    double close,
    double volume,
    double bidVolume,
    double askVolume,
    long timestampMillis
) {
    /**
     * Creates a bar without bid/ask volume split.
     */
    public static Bar of(double open, double high, double low, double close, double volume, long timestampMillis) {
        return new Bar(open, high, low, close, volume, 0.0, 0.0, timestampMillis);
    }
}
