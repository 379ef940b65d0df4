package io.trading.marketevent.model;

/**
 * Kind of a time and sales record.
 */
public enum TradeKind {
    BID,
    ASK,
    BIDASK,
    TRADE;

    /**
     * Returns true for records that describe a quote change rather than a trade.
     */
    public boolean isQuote() {
        return this != TRADE;
    }
}
