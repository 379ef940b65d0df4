package io.trading.marketevent.normalize;

/**
 * Parameters of the x100 scale correction applied by {@link PriceNormalizer}.
 * The host is known to sometimes deliver prices scaled by 100; which feeds do so
 * is not documented, so the threshold and pass count stay configurable.
 *
 * @param scaleThreshold Values above this are treated as scaled and divided
 * @param scaleDivisor   Divisor applied to scaled values
 * @param passes         Number of rescale-then-round passes (at least 1)
 */
public record NormalizerSettings(
    double scaleThreshold,
    double scaleDivisor,
    int passes
) {
    private static final double DEFAULT_SCALE_THRESHOLD = 10_000.0;
    private static final double DEFAULT_SCALE_DIVISOR = 100.0;
    private static final int DEFAULT_PASSES = 2;

    public NormalizerSettings {
        if (!(scaleThreshold > 0.0) || Double.isInfinite(scaleThreshold)) {
            throw new IllegalArgumentException("scaleThreshold must be positive and finite");
        }
        if (!(scaleDivisor > 1.0) || Double.isInfinite(scaleDivisor)) {
            throw new IllegalArgumentException("scaleDivisor must be greater than 1");
        }
        if (passes < 1) {
            throw new IllegalArgumentException("passes must be at least 1");
        }
    }

    public static NormalizerSettings defaults() {
        return new NormalizerSettings(DEFAULT_SCALE_THRESHOLD, DEFAULT_SCALE_DIVISOR, DEFAULT_PASSES);
    }

    public NormalizerSettings withScaleThreshold(double threshold) {
        return new NormalizerSettings(threshold, scaleDivisor, passes);
    }

    public NormalizerSettings withPasses(int count) {
        return new NormalizerSettings(scaleThreshold, scaleDivisor, count);
    }
}
