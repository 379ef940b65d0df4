package io.trading.marketevent.dedup;

import io.trading.marketevent.api.EventSink;
import io.trading.marketevent.model.EmittedEvent;

import java.util.HashMap;
import java.util.Map;

/**
 * Suppresses repeated emission of an unchanged value for a logical key.
 *
 * Values are compared structurally on the event payload (the field map); the
 * timestamp is excluded, so a snapshot re-read on a later update with the same
 * content is suppressed. Two payloads that would print the same text but hold
 * different numbers are both emitted.
 *
 * The key table grows with the distinct keys seen and is never evicted; key
 * cardinality is bounded by charts x event types x bars/levels.
 * Not thread-safe: one instance per source pipeline.
 */
public final class DedupWriter {

    private final EventSink sink;
    private final Map<DedupKey, Map<String, Object>> lastByKey = new HashMap<>();

    private long suppressedCount = 0;

    public DedupWriter(EventSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    /**
     * Emits the event unless its payload equals the last one emitted for the key.
     *
     * A payload the sink rejected is not remembered, so the next update writes it again.
     *
     * @return true if the event was written
     */
    public boolean writeIfChanged(DedupKey key, EmittedEvent event) {
        Map<String, Object> payload = event.fields();
        Map<String, Object> last = lastByKey.get(key);
        if (last != null && last.equals(payload)) {
            suppressedCount++;
            return false;
        }
        boolean written = sink.emit(event);
        if (written) {
            lastByKey.put(key, payload);
        }
        return written;
    }

    public int trackedKeyCount() {
        return lastByKey.size();
    }

    public long getSuppressedCount() {
        return suppressedCount;
    }
}
