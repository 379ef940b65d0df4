package io.trading.marketevent.engine;

/**
 * Order-flow study layout. Delta is always recomputed as ask - bid volume.
 *
 * @param studyId                 Study id, 0 to resolve by name
 * @param askSubgraph             Ask volume subgraph
 * @param bidSubgraph             Bid volume subgraph
 * @param deltaSubgraph           Delta subgraph, only checked for presence
 * @param tradesSubgraph          Number of trades subgraph
 * @param cumulativeDeltaSubgraph Cumulative delta of the day subgraph
 * @param newBarOnly              Export only once per bar
 */
public record OrderFlowSettings(
    int studyId,
    int askSubgraph,
    int bidSubgraph,
    int deltaSubgraph,
    int tradesSubgraph,
    int cumulativeDeltaSubgraph,
    boolean newBarOnly
) {
    public static final String STUDY_NAME = "Numbers Bars Calculated Values";

    public OrderFlowSettings {
        if (studyId < 0) {
            throw new IllegalArgumentException("studyId cannot be negative");
        }
        if (askSubgraph < 0 || bidSubgraph < 0 || deltaSubgraph < 0
            || tradesSubgraph < 0 || cumulativeDeltaSubgraph < 0) {
            throw new IllegalArgumentException("subgraph indexes cannot be negative");
        }
    }

    public static OrderFlowSettings defaults() {
        return new OrderFlowSettings(0, 5, 6, 1, 12, 10, true);
    }

    public OrderFlowSettings withStudyId(int id) {
        return new OrderFlowSettings(id, askSubgraph, bidSubgraph, deltaSubgraph,
            tradesSubgraph, cumulativeDeltaSubgraph, newBarOnly);
    }
}
