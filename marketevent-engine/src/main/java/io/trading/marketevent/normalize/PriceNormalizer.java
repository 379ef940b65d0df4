package io.trading.marketevent.normalize;

import io.trading.marketevent.model.NormalizedPrice;

import java.math.BigDecimal;

/**
 * Converts raw host prices into tick-aligned values.
 *
 * Steps:
 * 1. Divide by the real-time multiplier (1 when unset or zero)
 * 2. Divide by the scale divisor when above the plausibility threshold
 * 3. Round to the nearest tick
 * 4. Repeat 2-3 for the remaining passes, since rounding can leave a residual x100 value
 *
 * The correction is heuristic: a genuine price above the threshold is indistinguishable
 * from a scaled one. Stateless and thread-safe.
 */
public final class PriceNormalizer {

    private final NormalizerSettings settings;

    public PriceNormalizer(NormalizerSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    public PriceNormalizer() {
        this(NormalizerSettings.defaults());
    }

    /**
     * Normalizes a raw price.
     *
     * @param raw        Raw value from the host
     * @param tickSize   Instrument tick size; rounding is skipped when not positive
     * @param multiplier Real-time price multiplier; 0 means unset
     * @return the normalized price; non-finite input gives the invalid sentinel,
     *         zero or negative input is returned unnormalized and flagged invalid, and
     *         a value still above the threshold after all passes is flagged invalid
     */
    public NormalizedPrice normalize(double raw, double tickSize, double multiplier) {
        if (!Double.isFinite(raw)) {
            return NormalizedPrice.invalid();
        }
        if (raw <= 0.0) {
            return new NormalizedPrice(raw, false);
        }

        double divisor = (multiplier != 0.0 && Double.isFinite(multiplier)) ? multiplier : 1.0;
        double px = raw / divisor;
        if (!Double.isFinite(px) || px <= 0.0) {
            return NormalizedPrice.invalid();
        }

        for (int pass = 0; pass < settings.passes(); pass++) {
            if (px > settings.scaleThreshold()) {
                px /= settings.scaleDivisor();
            }
            px = roundToTick(px, tickSize);
        }
        if (px > settings.scaleThreshold()) {
            // still implausible after every pass
            return new NormalizedPrice(px, false);
        }
        if (px <= 0.0) {
            // rounded down to zero
            return new NormalizedPrice(px, false);
        }
        return NormalizedPrice.of(px);
    }

    /**
     * Rounds to the nearest multiple of the tick size.
     * The product is formed in decimal so that 3 ticks of 0.1 give 0.3, not 0.30000000000000004.
     */
    public static double roundToTick(double value, double tickSize) {
        if (!(tickSize > 0.0) || !Double.isFinite(tickSize)) {
            return value;
        }
        long ticks = Math.round(value / tickSize);
        return BigDecimal.valueOf(ticks).multiply(BigDecimal.valueOf(tickSize)).doubleValue();
    }

    /**
     * Aligns a derived value with the scale of a reference price:
     * x100 when the reference is above 1000 and the value below 100,
     * /100 when the reference is below 100 and the value above 1000.
     */
    public static double alignToReference(double value, double reference) {
        if (reference > 1000.0 && value > 0.0 && value < 100.0) {
            return value * 100.0;
        }
        if (reference < 100.0 && value > 1000.0) {
            return value / 100.0;
        }
        return value;
    }

    public NormalizerSettings getSettings() {
        return settings;
    }
}
