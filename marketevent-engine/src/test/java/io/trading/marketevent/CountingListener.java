package io.trading.marketevent;

import io.trading.marketevent.api.EngineListener;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that counts engine callbacks, for tests.
 */
public class CountingListener implements EngineListener {

    public int emitted;
    public int suppressed;
    public int invalidPrices;
    public int cursorResets;
    public int writeFailures;
    public final List<String> diagnostics = new ArrayList<>();
    public final List<String> collectorFailures = new ArrayList<>();

    @Override
    public void onEmitted(SourceId source, EventType type) {
        emitted++;
    }

    @Override
    public void onSuppressed(SourceId source, EventType type) {
        suppressed++;
    }

    @Override
    public void onDiagnostic(SourceId source, EventType type, String msg) {
        diagnostics.add(type.getTag() + ":" + msg);
    }

    @Override
    public void onInvalidPrice(SourceId source) {
        invalidPrices++;
    }

    @Override
    public void onCursorReset(SourceId source) {
        cursorResets++;
    }

    @Override
    public void onCollectorFailure(SourceId source, String collector) {
        collectorFailures.add(collector);
    }

    @Override
    public void onWriteFailure(SourceId source, EventType type) {
        writeFailures++;
    }
}
