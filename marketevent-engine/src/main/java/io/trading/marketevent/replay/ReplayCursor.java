package io.trading.marketevent.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks what has already been consumed from an append-only source.
 *
 * The strategy is probed once, on the first poll that sees a non-empty source,
 * and never re-probed. In sequence mode, records with sequence 0 are treated as
 * not yet assigned: they are skipped and do not advance the cursor.
 *
 * A source that shrinks below the tracked position (or, in sequence mode, whose
 * newest sequence falls below the last one emitted) has been purged; the cursor
 * restarts from zero and re-emits what remains. Consumers must tolerate the
 * resulting duplicates.
 *
 * Not thread-safe: one cursor per source pipeline.
 */
public final class ReplayCursor<T extends SequencedRecord> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplayCursor.class);

    public static final int DEFAULT_PROBE_WINDOW = 50;

    private final String name;
    private final int probeWindow;

    private ReplayStrategy strategy;
    private long lastSequence = 0;
    private int lastIndex = 0;
    private long resetCount = 0;

    public ReplayCursor(String name, int probeWindow) {
        if (probeWindow <= 0) {
            throw new IllegalArgumentException("probeWindow must be positive");
        }
        this.name = name;
        this.probeWindow = probeWindow;
    }

    public ReplayCursor(String name) {
        this(name, DEFAULT_PROBE_WINDOW);
    }

    /**
     * Returns the records appended since the previous poll.
     *
     * @param source Current snapshot of the source, oldest first
     */
    public PollResult<T> poll(List<? extends T> source) {
        int size = source.size();
        if (strategy == null) {
            if (size == 0) {
                return PollResult.empty();
            }
            strategy = ReplayStrategy.detectCapability(source, probeWindow);
            LOGGER.info("[{}] Replay strategy selected: {}", name, strategy);
        }

        return switch (strategy) {
            case SEQUENCE_BASED -> pollBySequence(source, size);
            case INDEX_BASED -> pollByIndex(source, size);
        };
    }

    private PollResult<T> pollByIndex(List<? extends T> source, int size) {
        boolean reset = false;
        if (size < lastIndex) {
            reset(size);
            reset = true;
        }
        List<T> fresh = new ArrayList<>(size - lastIndex);
        for (int i = lastIndex; i < size; i++) {
            fresh.add(source.get(i));
        }
        lastIndex = size;
        return new PollResult<>(fresh, reset);
    }

    private PollResult<T> pollBySequence(List<? extends T> source, int size) {
        boolean reset = false;
        if (size < lastIndex || newestSequence(source) < lastSequence) {
            reset(size);
            reset = true;
        }

        // sequences are monotonic: walk back to the last record already emitted
        int start = size;
        while (start > 0) {
            long seq = source.get(start - 1).sequence();
            if (seq != 0 && seq <= lastSequence) {
                break;
            }
            start--;
        }

        long threshold = lastSequence;
        List<T> fresh = new ArrayList<>(size - start);
        for (int i = start; i < size; i++) {
            T record = source.get(i);
            long seq = record.sequence();
            if (seq == 0 || seq <= threshold) {
                continue;
            }
            fresh.add(record);
            if (seq > lastSequence) {
                lastSequence = seq;
            }
        }
        lastIndex = size;
        return new PollResult<>(fresh, reset);
    }

    /**
     * Newest nonzero sequence in the source, or {@code Long.MAX_VALUE} when none is assigned
     * so that an all-zero tail never looks like a rollback.
     */
    private long newestSequence(List<? extends T> source) {
        for (int i = source.size() - 1; i >= 0; i--) {
            long seq = source.get(i).sequence();
            if (seq != 0) {
                return seq;
            }
        }
        return Long.MAX_VALUE;
    }

    private void reset(int size) {
        resetCount++;
        LOGGER.warn("[{}] Source truncated (size={}, position={}, lastSequence={}), replaying from start",
            name, size, lastIndex, lastSequence);
        lastIndex = 0;
        lastSequence = 0;
    }

    /**
     * Selected strategy, or null before the first non-empty poll.
     */
    public ReplayStrategy getStrategy() {
        return strategy;
    }

    public long getLastSequence() {
        return lastSequence;
    }

    public int getLastIndex() {
        return lastIndex;
    }

    public long getResetCount() {
        return resetCount;
    }
}
