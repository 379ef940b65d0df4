package io.trading.marketevent.replay;

/**
 * Record of an append-only source that may carry a host sequence number.
 */
public interface SequencedRecord {

    /**
     * Host sequence number; 0 means not assigned.
     */
    long sequence();
}
