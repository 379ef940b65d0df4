package io.trading.marketevent.model;

/**
 * One update notification from the charting host.
 * The payload is pulled from the market data source while the update is handled.
 *
 * @param source           Chart that changed
 * @param receivedAtMillis Wall-clock receive time in epoch milliseconds
 */
public record RawUpdate(
    SourceId source,
    long receivedAtMillis
) {
    public RawUpdate {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
    }
}
