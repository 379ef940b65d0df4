package io.trading.marketevent.engine;

/**
 * Where to read the session VWAP study.
 *
 * Subgraph 0 holds the VWAP; band pair k sits at subgraphs 2k-1 (upper) and 2k (lower).
 *
 * @param studyId   Preferred study id, 0 to resolve by name only
 * @param bandCount Band pairs to export (0..4)
 */
public record VwapSettings(
    int studyId,
    int bandCount
) {
    public static final String[] STUDY_NAMES = {
        "Volume Weighted Average Price",
        "VWAP (Volume Weighted Average Price)"
    };

    public static final int MAX_BANDS = 4;

    public VwapSettings {
        if (studyId < 0) {
            throw new IllegalArgumentException("studyId cannot be negative");
        }
        if (bandCount < 0 || bandCount > MAX_BANDS) {
            throw new IllegalArgumentException("bandCount must be between 0 and " + MAX_BANDS);
        }
    }

    public static VwapSettings defaults() {
        return new VwapSettings(0, 2);
    }
}
