package io.trading.dumper.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthMonitor.
 */
class HealthMonitorTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new HealthMonitor(1000, 60_000, now::get);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void testHealthyWhenConnectedAndFresh() {
        FakeChecker checker = new FakeChecker(true, now.get() - 1000, 5);
        monitor.registerChart(3, checker);

        monitor.performHealthCheck();

        assertTrue(monitor.isHealthy());
        HealthMonitor.ChartStats stats = monitor.getStats(3);
        assertEquals(3, stats.getChart());
        assertTrue(stats.isConnected());
        assertFalse(stats.isStale());
        assertEquals(5, stats.getUpdateCount());
    }

    @Test
    void testStaleAfterThreshold() {
        FakeChecker checker = new FakeChecker(true, now.get(), 1);
        monitor.registerChart(3, checker);

        now.addAndGet(60_001);
        monitor.performHealthCheck();

        assertTrue(monitor.getStats(3).isStale());
        assertFalse(monitor.isHealthy());

        checker.lastUpdate = now.get();
        monitor.performHealthCheck();
        assertFalse(monitor.getStats(3).isStale());
        assertTrue(monitor.isHealthy());
    }

    @Test
    void testNeverUpdatedChartIsNotStale() {
        monitor.registerChart(3, new FakeChecker(true, 0, 0));

        now.addAndGet(600_000);
        monitor.performHealthCheck();

        assertFalse(monitor.getStats(3).isStale());
        assertTrue(monitor.isHealthy());
    }

    @Test
    void testDisconnectIsCountedOncePerTransition() {
        FakeChecker checker = new FakeChecker(false, now.get(), 1);
        monitor.registerChart(3, checker);

        monitor.performHealthCheck();
        monitor.performHealthCheck();

        HealthMonitor.ChartStats stats = monitor.getStats(3);
        assertFalse(monitor.isHealthy());
        assertFalse(stats.isStale());
        assertEquals(1, stats.getDisconnectCount());
        assertEquals(now.get(), stats.getLastDisconnectTime());

        checker.connected = true;
        monitor.performHealthCheck();
        checker.connected = false;
        now.addAndGet(10);
        monitor.performHealthCheck();

        assertEquals(2, stats.getDisconnectCount());
        assertEquals(now.get(), stats.getLastDisconnectTime());
    }

    @Test
    void testOneUnhealthyChartMakesMonitorUnhealthy() {
        monitor.registerChart(3, new FakeChecker(true, now.get(), 1));
        monitor.registerChart(4, new FakeChecker(false, now.get(), 1));

        monitor.performHealthCheck();

        assertFalse(monitor.isHealthy());
        assertEquals(2, monitor.getAllStats().size());
    }

    private static final class FakeChecker implements HealthMonitor.ChartChecker {
        private volatile boolean connected;
        private volatile long lastUpdate;
        private final long updates;

        FakeChecker(boolean connected, long lastUpdate, long updates) {
            this.connected = connected;
            this.lastUpdate = lastUpdate;
            this.updates = updates;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public long getLastUpdateMillis() {
            return lastUpdate;
        }

        @Override
        public long getUpdateCount() {
            return updates;
        }
    }
}
