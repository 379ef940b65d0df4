package io.trading.marketevent.model;

/**
 * Tick-aligned price produced by the price normalizer.
 * An invalid price is never emitted; callers drop the field or record.
 *
 * @param value Normalized value, or the raw value when invalid
 * @param valid Whether the value is usable
 */
public record NormalizedPrice(
    double value,
    boolean valid
) {
    private static final NormalizedPrice INVALID = new NormalizedPrice(0.0, false);

    /**
     * Sentinel returned for non-finite input.
     */
    public static NormalizedPrice invalid() {
        return INVALID;
    }

    public static NormalizedPrice of(double value) {
        return new NormalizedPrice(value, true);
    }
}
