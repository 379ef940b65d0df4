package io.trading.marketevent.session;

/**
 * Inclusive bar index range of one trading session.
 *
 * @param startIndex First bar of the session
 * @param endIndex   Last bar of the session
 */
public record SessionWindow(
    int startIndex,
    int endIndex
) {
    public SessionWindow {
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex cannot be negative");
        }
        if (endIndex < startIndex) {
            throw new IllegalArgumentException("endIndex must be >= startIndex");
        }
    }

    public int barCount() {
        return endIndex - startIndex + 1;
    }
}
