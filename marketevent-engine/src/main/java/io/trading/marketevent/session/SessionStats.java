package io.trading.marketevent.session;

import java.util.List;

/**
 * Volume-weighted statistics of a completed session.
 *
 * @param window      Bars the statistics were computed over
 * @param mean        Volume-weighted average price
 * @param sigma       Volume-weighted standard deviation
 * @param totalVolume Volume covered by the samples
 * @param bands       Symmetric deviation bands, innermost first
 */
public record SessionStats(
    SessionWindow window,
    double mean,
    double sigma,
    double totalVolume,
    List<Band> bands
) {
    public SessionStats {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("mean must be finite");
        }
        if (!(sigma >= 0.0)) {
            throw new IllegalArgumentException("sigma must be >= 0");
        }
        bands = List.copyOf(bands);
    }

    /**
     * Band pair {@code mean +/- multiplier * sigma}.
     *
     * @param level      1-based band number, used in field names
     * @param multiplier Sigma multiplier
     * @param upper      Upper edge
     * @param lower      Lower edge
     */
    public record Band(int level, double multiplier, double upper, double lower) {
    }
}
