package io.trading.marketevent.model;

/**
 * One price/size pair at a given rank of the order book.
 *
 * @param price Price at this level (raw)
 * @param size  Resting quantity at this level
 */
public record DepthEntry(
    double price,
    long size
) {
    /**
     * Returns whether the level carries a usable price and quantity.
     */
    public boolean isPopulated() {
        return price != 0.0 && size != 0;
    }
}
