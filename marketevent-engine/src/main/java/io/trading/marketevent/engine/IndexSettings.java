package io.trading.marketevent.engine;

import io.trading.marketevent.model.SourceId;

/**
 * External index (e.g., VIX) read either from the last price of another chart
 * or from a study subgraph on the source chart.
 *
 * @param mode     Where to read
 * @param chart    Index chart, required in {@link Mode#CHART}
 * @param studyId  Overlay study id, required in {@link Mode#STUDY}
 * @param subgraph Overlay study subgraph
 */
public record IndexSettings(
    Mode mode,
    SourceId chart,
    int studyId,
    int subgraph
) {
    public enum Mode {
        CHART(0),
        STUDY(1);

        private final int code;

        Mode(int code) {
            this.code = code;
        }

        /**
         * Numeric code written to the {@code mode} field.
         */
        public int getCode() {
            return code;
        }
    }

    public IndexSettings {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (mode == Mode.CHART && chart == null) {
            throw new IllegalArgumentException("chart mode requires an index chart");
        }
        if (mode == Mode.STUDY && studyId <= 0) {
            throw new IllegalArgumentException("study mode requires a positive studyId");
        }
    }

    public static IndexSettings fromChart(SourceId chart) {
        return new IndexSettings(Mode.CHART, chart, 0, 0);
    }

    public static IndexSettings fromStudy(int studyId, int subgraph) {
        return new IndexSettings(Mode.STUDY, null, studyId, subgraph);
    }
}
