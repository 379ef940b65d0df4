package io.trading.marketevent.session;

/**
 * Point of control and value area of a volume profile.
 *
 * @param poc         Price with the most volume
 * @param vah         Value area high
 * @param val         Value area low
 * @param totalVolume Volume of the whole profile
 */
public record ValueArea(
    double poc,
    double vah,
    double val,
    double totalVolume
) {
    public ValueArea {
        if (val > vah) {
            throw new IllegalArgumentException("val must be <= vah");
        }
        if (poc < val || poc > vah) {
            throw new IllegalArgumentException("poc must lie inside the value area");
        }
    }
}
