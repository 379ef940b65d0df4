package io.trading.marketevent.engine;

import io.trading.marketevent.align.CrossTimeframeAligner;
import io.trading.marketevent.api.EngineListener;
import io.trading.marketevent.api.EventSink;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.dedup.DedupKey;
import io.trading.marketevent.dedup.DedupWriter;
import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.NormalizedPrice;
import io.trading.marketevent.model.RawUpdate;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.PriceNormalizer;

import java.util.function.Consumer;

/**
 * Everything a collector needs while one update is handled: the source snapshot
 * taken at the start of the update, the per-source state and the emit paths.
 */
public final class EmitContext {

    private final MarketDataSource data;
    private final SourceId source;
    private final EngineConfig config;
    private final EngineState state;
    private final PriceNormalizer normalizer;
    private final CrossTimeframeAligner aligner;
    private final EventSink sink;
    private final EngineListener listener;
    private final RawUpdate update;
    private final int lastIndex;
    private final Bar lastBar;

    EmitContext(MarketDataSource data, EngineConfig config, EngineState state, PriceNormalizer normalizer,
                CrossTimeframeAligner aligner, EventSink sink, EngineListener listener, RawUpdate update) {
        this.data = data;
        this.source = state.getSource();
        this.config = config;
        this.state = state;
        this.normalizer = normalizer;
        this.aligner = aligner;
        this.sink = sink;
        this.listener = listener;
        this.update = update;
        int count = data.barCount(source);
        this.lastIndex = count - 1;
        this.lastBar = count > 0 ? data.bar(source, lastIndex) : null;
    }

    public MarketDataSource data() {
        return data;
    }

    public SourceId source() {
        return source;
    }

    public EngineConfig config() {
        return config;
    }

    public EngineState state() {
        return state;
    }

    public EngineListener listener() {
        return listener;
    }

    public CrossTimeframeAligner aligner() {
        return aligner;
    }

    public RawUpdate update() {
        return update;
    }

    public boolean hasBars() {
        return lastBar != null;
    }

    /**
     * Index of the latest bar, -1 when the chart has none.
     */
    public int lastIndex() {
        return lastIndex;
    }

    /**
     * Latest bar, or null when the chart has none.
     */
    public Bar lastBar() {
        return lastBar;
    }

    /**
     * Event time: start of the latest bar, or the receive time before the first bar.
     */
    public long time() {
        return lastBar != null ? lastBar.timestampMillis() : update.receivedAtMillis();
    }

    /**
     * Normalizes a price of the given chart with that chart's tick size and multiplier.
     * A value that fails normalization is counted unless it is zero or NaN, which mean
     * "no value" on the host side.
     */
    public NormalizedPrice price(SourceId chart, double raw) {
        NormalizedPrice price = normalizer.normalize(raw, data.tickSize(chart), data.realTimeMultiplier(chart));
        if (!price.valid() && raw != 0.0 && !Double.isNaN(raw)) {
            listener.onInvalidPrice(chart);
        }
        return price;
    }

    public NormalizedPrice price(double raw) {
        return price(source, raw);
    }

    /**
     * Counts prices dropped by a component that normalizes on its own.
     */
    public void reportInvalidPrices(SourceId chart, int count) {
        for (int i = 0; i < count; i++) {
            listener.onInvalidPrice(chart);
        }
    }

    public PriceNormalizer normalizer() {
        return normalizer;
    }

    public EmittedEvent.Builder builder(EventType type) {
        return EmittedEvent.builder(type, source, time());
    }

    public EmittedEvent.Builder builder(EventType type, SourceId chart) {
        return EmittedEvent.builder(type, chart, time());
    }

    /**
     * Emits without dedup; used for append-style records that the replay cursor already deduplicates.
     */
    public boolean emit(EmittedEvent event) {
        boolean written = sink.emit(event);
        if (written) {
            listener.onEmitted(event.source(), event.type());
        }
        return written;
    }

    /**
     * Emits unless the payload equals the last one emitted for the key.
     */
    public boolean emitIfChanged(DedupKey key, EmittedEvent event) {
        DedupWriter dedup = state.getDedup();
        long suppressedBefore = dedup.getSuppressedCount();
        boolean written = dedup.writeIfChanged(key, event);
        if (written) {
            listener.onEmitted(event.source(), event.type());
        } else if (dedup.getSuppressedCount() != suppressedBefore) {
            listener.onSuppressed(event.source(), event.type());
        }
        return written;
    }

    /**
     * Emits a diagnostic once per chart, message and index.
     *
     * @param extra Additional fields, may be null
     */
    public void diagnostic(EventType type, SourceId chart, String msg, int index, Consumer<EmittedEvent.Builder> extra) {
        diagnostic(type, chart, msg, "", index, extra);
    }

    /**
     * Emits a diagnostic once per chart, message, scope and index.
     *
     * @param scope Distinguishes diagnostics of several inputs sharing an index (e.g., a study id)
     * @param extra Additional fields, may be null
     */
    public void diagnostic(EventType type, SourceId chart, String msg, String scope, int index,
                           Consumer<EmittedEvent.Builder> extra) {
        EmittedEvent.Builder builder = builder(type, chart).field("msg", msg);
        if (extra != null) {
            extra.accept(builder);
        }
        String qualifier = scope.isEmpty() ? msg : msg + "/" + scope;
        if (emitIfChanged(DedupKey.of(chart, type, qualifier, index), builder.build())) {
            listener.onDiagnostic(chart, type, msg);
        }
    }

    public void diagnostic(EventType type, String msg, int index) {
        diagnostic(type, source, msg, index, null);
    }

    /**
     * Emits a diagnostic every time, bypassing dedup.
     */
    public void diagnosticAlways(EmittedEvent event) {
        if (emit(event)) {
            listener.onDiagnostic(event.source(), event.type(), event.message());
        }
    }
}
