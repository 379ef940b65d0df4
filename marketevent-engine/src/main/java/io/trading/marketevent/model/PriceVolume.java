package io.trading.marketevent.model;

/**
 * One volume-at-price element of a bar.
 *
 * @param price  Price (raw)
 * @param volume Volume traded at that price
 */
public record PriceVolume(
    double price,
    double volume
) {
}
