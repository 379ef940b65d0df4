package io.trading.marketevent.api;

import io.trading.marketevent.model.EmittedEvent;

/**
 * Destination of emitted events.
 */
public interface EventSink {

    /**
     * Appends one event.
     *
     * @return true if the event was written, false if it was dropped
     */
    boolean emit(EmittedEvent event);
}
