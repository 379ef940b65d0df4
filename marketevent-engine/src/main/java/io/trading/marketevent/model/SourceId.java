package io.trading.marketevent.model;

/**
 * Identity of one upstream chart.
 *
 * @param chart  Chart number assigned by the charting host
 * @param symbol Instrument symbol shown on the chart (e.g., "ESU25_FUT_CME")
 */
public record SourceId(
    int chart,
    String symbol
) {
    public SourceId {
        if (chart <= 0) {
            throw new IllegalArgumentException("chart must be positive");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "chart#" + chart + "(" + symbol + ")";
    }
}
