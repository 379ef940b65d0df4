package io.trading.dumper.aeron;

/**
 * Registry for the Aeron streams of the live mirror.
 *
 * Stream ID allocation: one IPC stream per chart, BASE + chart number.
 * Chart 3: 2003, chart 4: 2004, ...
 */
public class StreamRegistry {

    private static final int BASE_STREAM_ID = 2000;

    /**
     * Gets the stream ID for a chart.
     */
    public static int getStreamId(int chart) {
        if (chart <= 0) {
            throw new IllegalArgumentException("chart must be positive");
        }
        return BASE_STREAM_ID + chart;
    }

    /**
     * Gets the Aeron channel URI for a chart.
     */
    public static String getChannel(int chart) {
        return String.format(
            "aeron:ipc?term-length=128k|alias=dumper-chart-%d|session-id=%d",
            chart,
            getStreamId(chart)
        );
    }
}
