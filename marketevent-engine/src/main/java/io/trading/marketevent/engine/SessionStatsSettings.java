package io.trading.marketevent.engine;

/**
 * Previous-session VWAP export.
 *
 * @param bandCount  Sigma band pairs to export (0..4)
 * @param newBarOnly Recompute only when a new bar appears
 */
public record SessionStatsSettings(
    int bandCount,
    boolean newBarOnly
) {
    public SessionStatsSettings {
        if (bandCount < 0 || bandCount > 4) {
            throw new IllegalArgumentException("bandCount must be between 0 and 4");
        }
    }

    public static SessionStatsSettings defaults() {
        return new SessionStatsSettings(2, true);
    }
}
