package io.trading.marketevent.dedup;

import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;

/**
 * Logical slot whose last emitted value is remembered.
 *
 * @param source    Chart the record is written for
 * @param type      Event type
 * @param qualifier Sub-kind within the type (e.g., book side), empty when unused
 * @param index     Sub-index such as a bar index or depth level
 */
public record DedupKey(
    SourceId source,
    EventType type,
    String qualifier,
    int index
) {
    public DedupKey {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (qualifier == null) {
            throw new IllegalArgumentException("qualifier cannot be null");
        }
    }

    public static DedupKey of(SourceId source, EventType type, int index) {
        return new DedupKey(source, type, "", index);
    }

    public static DedupKey of(SourceId source, EventType type, String qualifier, int index) {
        return new DedupKey(source, type, qualifier, index);
    }
}
