package io.trading.marketevent.replay;

import java.util.List;

/**
 * Records made available by one cursor poll, in source order.
 *
 * @param records Newly available records
 * @param reset   True if the cursor detected a purge and restarted from the beginning
 */
public record PollResult<T>(
    List<T> records,
    boolean reset
) {
    public PollResult {
        records = List.copyOf(records);
    }

    public static <T> PollResult<T> empty() {
        return new PollResult<>(List.of(), false);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
