package io.trading.marketevent.engine;

/**
 * Value-area export. Study subgraphs: 1 = POC, 2 = VAH, 3 = VAL.
 * With both ids at 0 the value areas are computed from volume-at-price.
 *
 * @param currentStudyId  Study holding the current session's value area, 0 when none
 * @param previousStudyId Study holding the previous session's value area, 0 when none
 * @param share           Share of volume the computed value area covers
 * @param newBarOnly      Export only once per bar
 */
public record ValueAreaSettings(
    int currentStudyId,
    int previousStudyId,
    double share,
    boolean newBarOnly
) {
    public ValueAreaSettings {
        if (currentStudyId < 0 || previousStudyId < 0) {
            throw new IllegalArgumentException("study ids cannot be negative");
        }
        if (!(share > 0.0 && share <= 1.0)) {
            throw new IllegalArgumentException("share must be in (0, 1]");
        }
    }

    public static ValueAreaSettings defaults() {
        return new ValueAreaSettings(0, 0, 0.70, true);
    }

    public boolean usesStudies() {
        return currentStudyId > 0 || previousStudyId > 0;
    }
}
