package io.trading.dumper.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency statistics per chart and processing stage (e.g., "update", "publish").
 * Uses System.nanoTime(); thread-safe with atomic operations.
 */
public class ProcessingTimer {

    private static final long NANO_TO_MICRO = 1_000L;

    private final ConcurrentHashMap<TimerKey, TimerStats> statsMap = new ConcurrentHashMap<>();

    /**
     * Starts a timing operation.
     * @return a timing context that must be stopped with stop()
     */
    public TimingContext start() {
        return new TimingContext(System.nanoTime());
    }

    /**
     * Records a duration for the given chart and stage.
     *
     * @param chart        Chart number
     * @param stage        Processing stage
     * @param nanoDuration Duration in nanoseconds
     */
    public void record(int chart, String stage, long nanoDuration) {
        statsMap.computeIfAbsent(new TimerKey(chart, stage), k -> new TimerStats()).record(nanoDuration);
    }

    public TimerStats getStats(int chart, String stage) {
        return statsMap.get(new TimerKey(chart, stage));
    }

    public Map<TimerKey, TimerStats> getAllStats() {
        return statsMap;
    }

    public void clear() {
        statsMap.clear();
    }

    /**
     * Timing context returned by start().
     */
    public static class TimingContext {
        private final long startTime;

        TimingContext(long startTime) {
            this.startTime = startTime;
        }

        /**
         * Stops timing and returns duration in nanoseconds.
         */
        public long stop() {
            return System.nanoTime() - startTime;
        }

        public long stopMicros() {
            return stop() / NANO_TO_MICRO;
        }
    }

    /**
     * Chart and stage a duration is grouped under.
     */
    public record TimerKey(int chart, String stage) {
        @Override
        public String toString() {
            return "chart#" + chart + "/" + stage;
        }
    }

    /**
     * Statistics for a timer key.
     */
    public static class TimerStats {
        private final AtomicLong count = new AtomicLong(0);
        private final AtomicLong totalNanos = new AtomicLong(0);
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(long nanos) {
            count.incrementAndGet();
            totalNanos.addAndGet(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public long getCount() {
            return count.get();
        }

        public double getAvgMicros() {
            long c = count.get();
            return c > 0 ? (double) totalNanos.get() / c / NANO_TO_MICRO : 0.0;
        }

        public long getMinMicros() {
            long m = minNanos.get();
            return m == Long.MAX_VALUE ? 0 : m / NANO_TO_MICRO;
        }

        public long getMaxMicros() {
            return maxNanos.get() / NANO_TO_MICRO;
        }
    }
}
