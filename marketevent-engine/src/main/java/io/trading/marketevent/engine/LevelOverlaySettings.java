package io.trading.marketevent.engine;

import io.trading.marketevent.model.SourceId;

import java.util.List;

/**
 * Level studies read from an overlay chart.
 *
 * @param chart      Overlay chart holding the level studies
 * @param studies    Studies to export
 * @param newBarOnly Export once per new bar time of the source
 */
public record LevelOverlaySettings(
    SourceId chart,
    List<LevelStudy> studies,
    boolean newBarOnly
) {
    public LevelOverlaySettings {
        if (chart == null) {
            throw new IllegalArgumentException("chart cannot be null");
        }
        studies = List.copyOf(studies);
    }

    /**
     * One level study.
     *
     * @param studyId       Study id on the overlay chart
     * @param subgraphCount Subgraphs 1..n to read
     * @param role          Labelling of the subgraphs
     */
    public record LevelStudy(int studyId, int subgraphCount, LevelRole role) {
        public LevelStudy {
            if (studyId <= 0) {
                throw new IllegalArgumentException("studyId must be positive");
            }
            if (subgraphCount <= 0) {
                throw new IllegalArgumentException("subgraphCount must be positive");
            }
            if (role == null) {
                throw new IllegalArgumentException("role cannot be null");
            }
        }
    }

    /**
     * Gamma (19 subgraphs), swing (9) and blind spot (9) studies with ids 1, 2 and 3.
     */
    public static LevelOverlaySettings standard(SourceId chart) {
        return new LevelOverlaySettings(chart, List.of(
            new LevelStudy(1, 19, LevelRole.GAMMA),
            new LevelStudy(3, 9, LevelRole.BLIND_SPOT),
            new LevelStudy(2, 9, LevelRole.SWING)
        ), true);
    }
}
