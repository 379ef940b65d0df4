package io.trading.marketevent.replay;

import java.util.List;

/**
 * How a replay cursor remembers what it has already consumed.
 */
public enum ReplayStrategy {

    /**
     * Track the highest host sequence number emitted.
     */
    SEQUENCE_BASED,

    /**
     * Track the number of records emitted; used when the host assigns no sequence numbers.
     */
    INDEX_BASED;

    /**
     * Picks the strategy from the newest {@code probeWindow} records of a sample:
     * any nonzero sequence number selects {@link #SEQUENCE_BASED}.
     */
    public static ReplayStrategy detectCapability(List<? extends SequencedRecord> sample, int probeWindow) {
        int size = sample.size();
        int oldest = Math.max(0, size - probeWindow);
        for (int i = size - 1; i >= oldest; i--) {
            if (sample.get(i).sequence() > 0) {
                return SEQUENCE_BASED;
            }
        }
        return INDEX_BASED;
    }
}
