package io.trading.marketevent.engine.collector;

import io.trading.marketevent.engine.EmitContext;
import io.trading.marketevent.engine.Feature;

/**
 * One kind of export run on every update of a source.
 * Collectors are stateless; per-source state lives in the context.
 */
public interface EventCollector {

    Feature feature();

    void collect(EmitContext ctx);
}
