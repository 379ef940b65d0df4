package io.trading.marketevent.api;

/**
 * Read-only view of one study subgraph array, indexed by bar.
 */
public interface StudySeries {

    int size();

    double get(int barIndex);

    default boolean has(int barIndex) {
        return barIndex >= 0 && barIndex < size();
    }

    /**
     * Wraps a primitive array; the array is not copied.
     */
    static StudySeries of(double... values) {
        return new StudySeries() {
            @Override
            public int size() {
                return values.length;
            }

            @Override
            public double get(int barIndex) {
                return values[barIndex];
            }
        };
    }
}
