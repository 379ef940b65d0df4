package io.trading.marketevent.model;

import io.trading.marketevent.replay.SequencedRecord;

/**
 * One entry of the host's append-only time and sales log.
 *
 * @param timestampMillis Event time in epoch milliseconds
 * @param kind            Record kind
 * @param price           Trade price (raw)
 * @param volume          Trade volume
 * @param bid             Bid price at the time of the record (raw)
 * @param ask             Ask price at the time of the record (raw)
 * @param bidSize         Bid quantity
 * @param askSize         Ask quantity
 * @param sequence        Host sequence number, 0 when not assigned
 */
public record TimeAndSalesRecord(
    long timestampMillis,
    TradeKind kind,
    double price,
    long volume,
    double bid,
    double ask,
    int bidSize,
    int askSize,
    long sequence
) implements SequencedRecord {
    public TimeAndSalesRecord {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative");
        }
    }

    /**
     * Creates a trade record.
     */
    public static TimeAndSalesRecord trade(long timestampMillis, double price, long volume, long sequence) {
        return new TimeAndSalesRecord(timestampMillis, TradeKind.TRADE, price, volume, 0.0, 0.0, 0, 0, sequence);
    }

    /**
     * Creates a quote record.
     */
    public static TimeAndSalesRecord quote(long timestampMillis, TradeKind kind, double bid, double ask,
                                           int bidSize, int askSize, long sequence) {
        return new TimeAndSalesRecord(timestampMillis, kind, 0.0, 0L, bid, ask, bidSize, askSize, sequence);
    }
}
