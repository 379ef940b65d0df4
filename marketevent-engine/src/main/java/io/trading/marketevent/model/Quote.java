package io.trading.marketevent.model;

/**
 * Level 1 quote.
 *
 * @param bid     Best bid price (raw)
 * @param ask     Best ask price (raw)
 * @param bidSize Quantity at the best bid
 * @param askSize Quantity at the best ask
 */
public record Quote(
    double bid,
    double ask,
    int bidSize,
    int askSize
) {
    public static Quote empty() {
        return new Quote(0.0, 0.0, 0, 0);
    }
}
