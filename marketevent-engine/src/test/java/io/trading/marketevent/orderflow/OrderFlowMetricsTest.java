package io.trading.marketevent.orderflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderFlowMetrics.
 */
class OrderFlowMetricsTest {

    @Test
    void testBuyingPressure() {
        OrderFlowMetrics metrics = new OrderFlowMetrics(60, 40, 20, -5);

        assertEquals(20.0, metrics.delta(), 0.0);
        assertEquals(100.0, metrics.totalVolume(), 0.0);
        assertEquals(0.2, metrics.deltaRatio(), 1e-12);
        assertEquals(40.0 / 60.0, metrics.bidAskRatio(), 1e-12);
        assertEquals(1.5, metrics.askBidRatio(), 1e-12);
        assertTrue(metrics.isBullish());
        assertFalse(metrics.isBearish());
        assertTrue(metrics.isAbsorption());
        assertEquals(-1, metrics.deltaTrend());
        assertEquals(0.2, metrics.tradeIntensity(), 1e-12);
    }

    @Test
    void testBalancedBarIsNoAbsorption() {
        OrderFlowMetrics metrics = new OrderFlowMetrics(52, 48, 10, 0);

        assertFalse(metrics.isAbsorption());
        assertEquals(0, metrics.deltaTrend());
    }

    @Test
    void testEmptyBarHasZeroRatios() {
        OrderFlowMetrics metrics = new OrderFlowMetrics(0, 0, 0, 3);

        assertEquals(0.0, metrics.deltaRatio(), 0.0);
        assertEquals(0.0, metrics.bidAskRatio(), 0.0);
        assertEquals(0.0, metrics.askBidRatio(), 0.0);
        assertEquals(0.0, metrics.tradeIntensity(), 0.0);
        assertFalse(metrics.isAbsorption());
        assertFalse(metrics.isBullish());
        assertFalse(metrics.isBearish());
        assertEquals(1, metrics.deltaTrend());
    }
}
