package io.trading.marketevent.api;

import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;

/**
 * Observer of engine activity, used for metrics.
 * Called on the pipeline thread of the source; implementations must not block.
 */
public interface EngineListener {

    EngineListener NOOP = new EngineListener() { };

    default void onEmitted(SourceId source, EventType type) {
    }

    default void onSuppressed(SourceId source, EventType type) {
    }

    default void onDiagnostic(SourceId source, EventType type, String msg) {
    }

    default void onInvalidPrice(SourceId source) {
    }

    default void onCursorReset(SourceId source) {
    }

    default void onCollectorFailure(SourceId source, String collector) {
    }

    default void onWriteFailure(SourceId source, EventType type) {
    }
}
