package io.trading.dumper.config;

import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.SourceId;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChartConfig.
 */
class ChartConfigTest {

    @Test
    void testFromStringWithoutFeaturesEnablesAll() {
        ChartConfig config = ChartConfig.fromString("3:ESU25_FUT_CME");

        assertEquals(new SourceId(3, "ESU25_FUT_CME"), config.source());
        assertEquals(3, config.chart());
        assertEquals(EnumSet.allOf(Feature.class), config.features());
    }

    @Test
    void testFromStringWithFeatures() {
        ChartConfig config = ChartConfig.fromString("4:NQU25_FUT_CME:basedata, vwap,ORDER_FLOW");

        assertEquals(4, config.chart());
        assertEquals("NQU25_FUT_CME", config.source().symbol());
        assertEquals(Set.of(Feature.BASEDATA, Feature.VWAP, Feature.ORDER_FLOW), config.features());
    }

    @Test
    void testFromStringWithBlankFeatureListEnablesAll() {
        ChartConfig config = ChartConfig.fromString("3:ES:");
        assertEquals(EnumSet.allOf(Feature.class), config.features());
    }

    @Test
    void testFromStringInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> ChartConfig.fromString("ESU25_FUT_CME"));
        assertThrows(IllegalArgumentException.class, () -> ChartConfig.fromString("3:ES:vwap:extra"));
    }

    @Test
    void testFromStringInvalidChartNumber() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ChartConfig.fromString("three:ES"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testFromStringUnknownFeature() {
        assertThrows(IllegalArgumentException.class, () -> ChartConfig.fromString("3:ES:basedata,footprint"));
    }

    @Test
    void testParseSource() {
        assertEquals(new SourceId(8, "VIX"), ChartConfig.parseSource("8:VIX"));
        assertThrows(IllegalArgumentException.class, () -> ChartConfig.parseSource("8"));
        assertThrows(IllegalArgumentException.class, () -> ChartConfig.parseSource("0:VIX"));
    }

    @Test
    void testValidation() {
        SourceId es = new SourceId(3, "ES");
        assertThrows(IllegalArgumentException.class, () -> new ChartConfig(null, Set.of(Feature.VWAP)));
        assertThrows(IllegalArgumentException.class, () -> new ChartConfig(es, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new ChartConfig(es, null));
    }
}
