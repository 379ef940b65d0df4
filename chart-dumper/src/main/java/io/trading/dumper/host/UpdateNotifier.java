package io.trading.dumper.host;

/**
 * Callback a host bridge uses to signal that a chart has new data.
 */
@FunctionalInterface
public interface UpdateNotifier {

    /**
     * Called from any host thread; the dumper queues the update on the chart's pipeline.
     */
    void onChartUpdated(int chart);
}
