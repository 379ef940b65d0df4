package io.trading.marketevent.model;

/**
 * Order book side.
 */
public enum BookSide {
    BID,
    ASK
}
