package io.trading.marketevent.engine;

import io.trading.marketevent.CountingListener;
import io.trading.marketevent.RecordingSink;
import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.api.StudySeries;
import io.trading.marketevent.engine.LevelOverlaySettings.LevelStudy;
import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.BookSide;
import io.trading.marketevent.model.DepthEntry;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.PriceVolume;
import io.trading.marketevent.model.Quote;
import io.trading.marketevent.model.RawUpdate;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.model.TimeAndSalesRecord;
import io.trading.marketevent.model.TradeKind;
import io.trading.marketevent.replay.ReplayStrategy;
import io.trading.marketevent.source.InMemoryMarketDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChartEventEngine.
 */
class ChartEventEngineTest {

    private static final SourceId ES = new SourceId(3, "ESU25_FUT_CME");
    private static final SourceId ES_30M = new SourceId(4, "ESU25_FUT_CME");
    private static final SourceId OVERLAY = new SourceId(6, "ESU25_FUT_CME");
    private static final SourceId VIX = new SourceId(8, "VIX");
    private static final long T0 = 1_735_812_000_000L;
    private static final long MINUTE = 60_000L;

    private InMemoryMarketDataSource data;
    private RecordingSink sink;
    private CountingListener listener;

    @BeforeEach
    void setUp() {
        data = new InMemoryMarketDataSource();
        sink = new RecordingSink();
        listener = new CountingListener();
    }

    private ChartEventEngine engine(EngineConfig config) {
        return new ChartEventEngine(ES, data, config, sink, listener);
    }

    private ChartEventEngine engine(Feature first, Feature... rest) {
        return engine(EngineConfig.builder().features(first, rest).build());
    }

    private static RawUpdate update() {
        return new RawUpdate(ES, T0);
    }

    private static double num(EmittedEvent event, String field) {
        Object value = event.field(field);
        assertNotNull(value, "missing field " + field);
        return ((Number) value).doubleValue();
    }

    private static Bar bar(double close, long ts) {
        return Bar.of(close, close + 0.25, close - 0.25, close, 100, ts);
    }

    @Test
    void testPreviousSessionVwapEndToEnd() {
        data.addBar(3, bar(100.0, T0), true, List.of(
            new PriceVolume(100.0, 10),
            new PriceVolume(100.25, 5),
            new PriceVolume(99.75, 5)));
        data.addBar(3, bar(100.0, T0 + MINUTE), true, List.of());
        data.addBar(3, bar(100.25, T0 + 2 * MINUTE));
        data.addBar(3, bar(99.75, T0 + 3 * MINUTE));

        ChartEventEngine engine = engine(Feature.PREVIOUS_SESSION);
        engine.onUpdate(update());

        EmittedEvent pvwap = sink.last(EventType.PREVIOUS_SESSION);
        assertNotNull(pvwap);
        assertEquals(3, num(pvwap, "i"), 0.0);
        assertEquals(0, num(pvwap, "prev_start"), 0.0);
        assertEquals(0, num(pvwap, "prev_end"), 0.0);
        assertEquals(100.0, num(pvwap, "pvwap"), 1e-9);
        assertEquals(0.1767767, num(pvwap, "sigma"), 1e-6);
        assertEquals(100.0883883, num(pvwap, "up1"), 1e-6);
        assertEquals(99.9116117, num(pvwap, "dn1"), 1e-6);
        assertEquals(100.1767767, num(pvwap, "up2"), 1e-6);
        assertEquals(99.8232233, num(pvwap, "dn2"), 1e-6);
        assertNull(pvwap.field("up3"));
        assertEquals(T0 + 3 * MINUTE, pvwap.timestampMillis());

        engine.onUpdate(update());
        assertEquals(1, sink.ofType(EventType.PREVIOUS_SESSION).size());
    }

    @Test
    void testPreviousSessionInsufficientHistory() {
        data.addBar(3, bar(100.0, T0), true, List.of(new PriceVolume(100.0, 10)));
        data.addBar(3, bar(100.0, T0 + MINUTE));

        engine(Feature.PREVIOUS_SESSION).onUpdate(update());

        EmittedEvent diag = sink.last(EventType.PREVIOUS_SESSION_DIAG);
        assertEquals("insufficient_history", diag.message());
        assertTrue(sink.ofType(EventType.PREVIOUS_SESSION).isEmpty());
        assertEquals(List.of("pvwap_diag:insufficient_history"), listener.diagnostics);
    }

    @Test
    void testPreviousSessionWithoutVolume() {
        data.addBar(3, bar(100.0, T0), true, List.of());
        data.addBar(3, bar(100.0, T0 + MINUTE), true, List.of());

        engine(Feature.PREVIOUS_SESSION).onUpdate(update());

        EmittedEvent diag = sink.last(EventType.PREVIOUS_SESSION_DIAG);
        assertEquals("no_volume_prev_session", diag.message());
        assertEquals(0, num(diag, "prev_start"), 0.0);
        assertEquals(0, num(diag, "prev_end"), 0.0);
    }

    @Test
    void testDisconnectedSourceEmitsNothing() {
        data.addBar(3, bar(5000.0, T0));
        data.setQuote(3, new Quote(5000.0, 5000.25, 4, 6));
        data.setConnected(3, false);

        ChartEventEngine engine = engine(EngineConfig.builder().build());
        engine.onUpdate(update());

        assertTrue(sink.events().isEmpty());
        assertEquals(0, engine.getState().getUpdateCount());

        data.setConnected(3, true);
        engine.onUpdate(update());
        assertFalse(sink.events().isEmpty());
    }

    @Test
    void testUpdateForOtherChartIsRejected() {
        ChartEventEngine engine = engine(Feature.BASEDATA);

        assertThrows(IllegalArgumentException.class, () -> engine.onUpdate(new RawUpdate(ES_30M, T0)));
    }

    @Test
    void testFailingCollectorDoesNotStopOthers() {
        data.addBar(3, bar(5000.0, T0), true, List.of(new PriceVolume(5000.0, 10)));
        data.setQuote(3, new Quote(5000.0, 5000.25, 4, 6));
        MarketDataSource broken = new BrokenVolumeAtPriceSource(data);

        ChartEventEngine engine = new ChartEventEngine(ES, broken,
            EngineConfig.builder().features(Feature.BASEDATA, Feature.PREVIOUS_SESSION, Feature.QUOTES).build(),
            sink, listener);
        data.addBar(3, bar(5000.25, T0 + MINUTE), true, List.of());
        engine.onUpdate(update());

        assertEquals(List.of("previous_session"), listener.collectorFailures);
        assertEquals(1, sink.ofType(EventType.BASEDATA).size());
        assertEquals(1, sink.ofType(EventType.QUOTE).size());
    }

    @Test
    void testCollectorsFollowFeatureOrder() {
        ChartEventEngine engine = engine(Feature.TIME_AND_SALES, Feature.BASEDATA, Feature.QUOTES);

        assertEquals(List.of(Feature.BASEDATA, Feature.QUOTES, Feature.TIME_AND_SALES), engine.features());
    }

    @Test
    void testBaseDataIsDeduplicated() {
        data.addBar(3, new Bar(5000.0, 5001.0, 4999.5, 5000.5, 120, 50, 70, T0));
        ChartEventEngine engine = engine(Feature.BASEDATA);

        engine.onUpdate(update());
        engine.onUpdate(update());

        List<EmittedEvent> bars = sink.ofType(EventType.BASEDATA);
        assertEquals(1, bars.size());
        assertEquals(1, listener.suppressed);
        EmittedEvent first = bars.get(0);
        assertEquals(0, num(first, "i"), 0.0);
        assertEquals(5000.0, num(first, "o"), 0.0);
        assertEquals(5001.0, num(first, "h"), 0.0);
        assertEquals(4999.5, num(first, "l"), 0.0);
        assertEquals(5000.5, num(first, "c"), 0.0);
        assertEquals(120, num(first, "v"), 0.0);
        assertEquals(50, num(first, "bidvol"), 0.0);
        assertEquals(70, num(first, "askvol"), 0.0);

        data.updateLastBar(3, new Bar(5000.0, 5001.0, 4999.5, 5000.75, 130, 55, 75, T0));
        engine.onUpdate(update());
        assertEquals(2, sink.ofType(EventType.BASEDATA).size());
        assertEquals(5000.75, num(sink.last(EventType.BASEDATA), "c"), 0.0);
    }

    @Test
    void testScaledPricesAreCorrected() {
        data.addBar(3, Bar.of(500000.0, 500025.0, 499975.0, 500025.0, 10, T0));

        engine(Feature.BASEDATA).onUpdate(update());

        EmittedEvent bar = sink.last(EventType.BASEDATA);
        assertEquals(5000.0, num(bar, "o"), 0.0);
        assertEquals(5000.25, num(bar, "c"), 0.0);
    }

    @Test
    void testBarWithInvalidPriceIsDropped() {
        data.addBar(3, Bar.of(5000.0, 5001.0, -1.0, 5000.5, 10, T0));

        engine(Feature.BASEDATA).onUpdate(update());

        assertTrue(sink.ofType(EventType.BASEDATA).isEmpty());
        assertEquals(1, listener.invalidPrices);
    }

    @Test
    void testVwapResolvedByNameWithBands() {
        data.addBar(3, bar(100.0, T0));
        data.addBar(3, bar(100.25, T0 + MINUTE));
        data.addStudy(3, 7, "Volume Weighted Average Price");
        data.setSeries(3, 7, 0, 100.0, 100.25);
        data.setSeries(3, 7, 1, 0.0, 100.5);
        data.setSeries(3, 7, 2, 0.0, 100.0);

        ChartEventEngine engine = engine(Feature.VWAP);
        engine.onUpdate(update());
        engine.onUpdate(update());

        assertEquals(7, engine.getState().getVwapStudyId());
        List<EmittedEvent> diags = sink.ofType(EventType.VWAP_DIAG);
        assertEquals(1, diags.size());
        assertEquals("resolved", diags.get(0).message());
        assertEquals(7, num(diags.get(0), "resolved_id"), 0.0);

        List<EmittedEvent> vwaps = sink.ofType(EventType.VWAP);
        assertEquals(1, vwaps.size());
        EmittedEvent vwap = vwaps.get(0);
        assertEquals("study", vwap.field("src"));
        assertEquals(1, num(vwap, "i"), 0.0);
        assertEquals(100.25, num(vwap, "v"), 0.0);
        assertEquals(100.5, num(vwap, "up1"), 0.0);
        assertEquals(100.0, num(vwap, "dn1"), 0.0);
        assertNull(vwap.field("up2"));
        assertNull(vwap.field("dn2"));
    }

    @Test
    void testVwapConfiguredIdWinsOverName() {
        data.addBar(3, bar(100.0, T0));
        data.addStudy(3, 7, "Volume Weighted Average Price");
        data.setSeries(3, 7, 0, 100.0);
        data.setSeries(3, 11, 0, 100.25);

        ChartEventEngine engine = engine(EngineConfig.builder()
            .features(Feature.VWAP)
            .vwap(new VwapSettings(11, 0))
            .build());
        engine.onUpdate(update());

        assertEquals(11, engine.getState().getVwapStudyId());
        assertEquals(100.25, num(sink.last(EventType.VWAP), "v"), 0.0);
    }

    @Test
    void testVwapStudyNotFound() {
        data.addBar(3, bar(100.0, T0));

        ChartEventEngine engine = engine(Feature.VWAP);
        engine.onUpdate(update());
        engine.onUpdate(update());

        assertEquals(EngineState.STUDY_NOT_FOUND, engine.getState().getVwapStudyId());
        assertTrue(sink.ofType(EventType.VWAP).isEmpty());
        List<EmittedEvent> diags = sink.ofType(EventType.VWAP_DIAG);
        assertEquals(2, diags.size());
        assertEquals(-1, num(diags.get(0), "resolved_id"), 0.0);
        assertEquals("study_not_found", diags.get(1).message());
    }

    @Test
    void testValueAreaFromVolumeAtPrice() {
        data.addBar(3, bar(100.0, T0), true, List.of(
            new PriceVolume(99.75, 2),
            new PriceVolume(100.0, 10),
            new PriceVolume(100.25, 4)));

        engine(Feature.VALUE_AREA).onUpdate(update());

        EmittedEvent vva = sink.last(EventType.VALUE_AREA);
        assertEquals("vap", vva.field("src"));
        assertEquals(100.0, num(vva, "vpoc"), 0.0);
        assertEquals(100.25, num(vva, "vah"), 0.0);
        assertEquals(100.0, num(vva, "val"), 0.0);
        assertNull(vva.field("ppoc"));
    }

    @Test
    void testValueAreaFromStudiesSwapsInvertedBounds() {
        data.addBar(3, bar(100.0, T0));
        data.setSeries(3, 5, 1, 100.0);
        data.setSeries(3, 5, 2, 99.5);
        data.setSeries(3, 5, 3, 100.5);

        engine(EngineConfig.builder()
            .features(Feature.VALUE_AREA)
            .valueArea(new ValueAreaSettings(5, 0, 0.70, true))
            .build()).onUpdate(update());

        EmittedEvent vva = sink.last(EventType.VALUE_AREA);
        assertEquals("study", vva.field("src"));
        assertEquals(100.5, num(vva, "vah"), 0.0);
        assertEquals(99.5, num(vva, "val"), 0.0);
        assertEquals(100.0, num(vva, "vpoc"), 0.0);
        assertEquals(5, num(vva, "id_curr"), 0.0);
    }

    @Test
    void testTimeAndSalesReplayAndPurge() {
        data.addBar(3, bar(5000.0, T0));
        data.appendTimeAndSales(3,
            TimeAndSalesRecord.trade(T0 + 1_000, 5000.0, 2, 1),
            TimeAndSalesRecord.trade(T0 + 2_000, 5000.25, 1, 2),
            TimeAndSalesRecord.quote(T0 + 3_000, TradeKind.BIDASK, 5000.0, 5000.25, 8, 9, 3));

        ChartEventEngine engine = engine(Feature.TIME_AND_SALES);
        engine.onUpdate(update());

        assertEquals(ReplayStrategy.SEQUENCE_BASED, engine.getState().getCursor().getStrategy());
        List<EmittedEvent> trades = sink.ofType(EventType.TRADE);
        assertEquals(2, trades.size());
        assertEquals(T0 + 1_000, trades.get(0).timestampMillis());
        assertEquals(5000.0, num(trades.get(0), "px"), 0.0);
        assertEquals(2, num(trades.get(0), "vol"), 0.0);
        assertEquals(1, num(trades.get(0), "seq"), 0.0);
        EmittedEvent quote = sink.last(EventType.QUOTE);
        assertEquals("BIDASK", quote.field("kind"));
        assertEquals(3, num(quote, "seq"), 0.0);

        engine.onUpdate(update());
        assertEquals(3, sink.events().size());

        data.appendTimeAndSales(3, TimeAndSalesRecord.trade(T0 + 4_000, 5000.5, 3, 4));
        engine.onUpdate(update());
        assertEquals(3, sink.ofType(EventType.TRADE).size());

        data.purgeTimeAndSales(3, 1);
        engine.onUpdate(update());

        EmittedEvent reset = sink.last(EventType.TIME_AND_SALES_DIAG);
        assertEquals("cursor_reset", reset.message());
        assertEquals("SEQUENCE_BASED", reset.field("strategy"));
        assertEquals(1, num(reset, "size"), 0.0);
        assertEquals(1, listener.cursorResets);
        // the surviving record is replayed once more
        assertEquals(4, sink.ofType(EventType.TRADE).size());
    }

    @Test
    void testQuoteWrittenOnChange() {
        data.setQuote(3, new Quote(5000.0, 5000.25, 4, 6));
        ChartEventEngine engine = engine(Feature.QUOTES);

        engine.onUpdate(update());
        engine.onUpdate(update());

        List<EmittedEvent> quotes = sink.ofType(EventType.QUOTE);
        assertEquals(1, quotes.size());
        EmittedEvent quote = quotes.get(0);
        assertEquals("BIDASK", quote.field("kind"));
        assertEquals(0.25, num(quote, "spread"), 0.0);
        assertEquals(5000.125, num(quote, "mid"), 0.0);
        assertEquals(4, num(quote, "bq"), 0.0);
        assertEquals(6, num(quote, "aq"), 0.0);
        // no bars yet: stamped with the receive time
        assertEquals(T0, quote.timestampMillis());

        data.setQuote(3, new Quote(5000.0, 5000.25, 5, 6));
        engine.onUpdate(update());
        assertEquals(2, sink.ofType(EventType.QUOTE).size());
    }

    @Test
    void testBarTradeIsWrittenOnEveryChange() {
        data.addBar(3, Bar.of(100.0, 100.0, 100.0, 100.0, 1, T0));
        ChartEventEngine engine = engine(Feature.TRADES);

        engine.onUpdate(update());
        engine.onUpdate(update());
        data.updateLastBar(3, Bar.of(100.0, 100.5, 100.0, 100.5, 7, T0));
        engine.onUpdate(update());
        data.updateLastBar(3, Bar.of(100.0, 100.5, 99.75, 99.75, 20, T0));
        engine.onUpdate(update());

        List<EmittedEvent> trades = sink.ofType(EventType.TRADE);
        assertEquals(3, trades.size());
        assertEquals(1, listener.suppressed);
        assertEquals("basedata", trades.get(0).field("source"));
        assertEquals(100.0, num(trades.get(0), "px"), 0.0);
        assertEquals(1, num(trades.get(0), "qty"), 0.0);
        assertEquals(100.5, num(trades.get(1), "px"), 0.0);
        assertEquals(7, num(trades.get(1), "qty"), 0.0);
        assertEquals(99.75, num(trades.get(2), "px"), 0.0);
        assertEquals(20, num(trades.get(2), "qty"), 0.0);
        assertEquals(T0, trades.get(2).timestampMillis());
    }

    @Test
    void testBarTradeSkipsBarWithoutVolume() {
        data.addBar(3, Bar.of(100.0, 100.0, 100.0, 100.0, 0, T0));

        engine(Feature.TRADES).onUpdate(update());

        assertTrue(sink.ofType(EventType.TRADE).isEmpty());
    }

    @Test
    void testEmptyQuoteIsSkipped() {
        engine(Feature.QUOTES).onUpdate(update());

        assertTrue(sink.events().isEmpty());
    }

    @Test
    void testDepthLevelOneFollowsQuote() {
        data.setQuote(3, new Quote(5000.0, 5000.25, 5, 7));
        data.setDepth(3, BookSide.BID, 1, new DepthEntry(4999.5, 3));
        data.setDepth(3, BookSide.BID, 2, new DepthEntry(4999.75, 9));
        data.setDepth(3, BookSide.ASK, 1, new DepthEntry(5000.5, 1));
        data.setDepth(3, BookSide.ASK, 3, new DepthEntry(5001.0, 2));

        ChartEventEngine engine = engine(EngineConfig.builder()
            .features(Feature.DEPTH)
            .maxDepthLevels(2)
            .build());
        engine.onUpdate(update());

        List<EmittedEvent> depth = sink.ofType(EventType.DEPTH);
        assertEquals(3, depth.size());

        EmittedEvent bid1 = depth.get(0);
        assertEquals("BID", bid1.field("side"));
        assertEquals(1, num(bid1, "lvl"), 0.0);
        assertEquals(5000.0, num(bid1, "price"), 0.0);
        assertEquals(5, num(bid1, "size"), 0.0);

        EmittedEvent ask1 = depth.get(1);
        assertEquals("ASK", ask1.field("side"));
        assertEquals(5000.25, num(ask1, "price"), 0.0);
        assertEquals(7, num(ask1, "size"), 0.0);

        EmittedEvent bid2 = depth.get(2);
        assertEquals(2, num(bid2, "lvl"), 0.0);
        assertEquals(4999.75, num(bid2, "price"), 0.0);

        engine.onUpdate(update());
        assertEquals(3, sink.ofType(EventType.DEPTH).size());
    }

    @Test
    void testOrderFlowRecords() {
        data.addBar(3, bar(5000.0, T0));
        data.addStudy(3, 9, OrderFlowSettings.STUDY_NAME);
        data.setSeries(3, 9, 5, 60);
        data.setSeries(3, 9, 6, 40);
        data.setSeries(3, 9, 1, 20);
        data.setSeries(3, 9, 12, 20);
        data.setSeries(3, 9, 10, -5);

        engine(Feature.ORDER_FLOW).onUpdate(update());

        EmittedEvent footprint = sink.last(EventType.ORDER_FLOW_FOOTPRINT);
        assertEquals(60, num(footprint, "ask_volume"), 0.0);
        assertEquals(40, num(footprint, "bid_volume"), 0.0);
        assertEquals(20, num(footprint, "delta"), 0.0);
        assertEquals(20, num(footprint, "trades"), 0.0);
        assertEquals(-5, num(footprint, "cumulative_delta"), 0.0);
        assertEquals(100, num(footprint, "total_volume"), 0.0);

        EmittedEvent metrics = sink.last(EventType.ORDER_FLOW_METRICS);
        assertEquals(0.2, num(metrics, "delta_ratio"), 1e-12);
        assertEquals(1, num(metrics, "pressure_bullish"), 0.0);
        assertEquals(0, num(metrics, "pressure_bearish"), 0.0);

        EmittedEvent flow = sink.last(EventType.ORDER_FLOW_IMBALANCE);
        assertEquals(0.2, num(flow, "volume_imbalance"), 1e-12);
        assertEquals(0.2, num(flow, "trade_intensity"), 1e-12);
        assertEquals(-1, num(flow, "delta_trend"), 0.0);
        assertEquals(1, num(flow, "absorption_pattern"), 0.0);
    }

    @Test
    void testOrderFlowInsufficientData() {
        data.addBar(3, bar(5000.0, T0));
        data.addStudy(3, 9, OrderFlowSettings.STUDY_NAME);
        data.setSeries(3, 9, 5, 60);

        engine(Feature.ORDER_FLOW).onUpdate(update());

        EmittedEvent diag = sink.last(EventType.ORDER_FLOW_DIAG);
        assertEquals("insufficient_data", diag.message());
        assertEquals(1, num(diag, "ask_sz"), 0.0);
        assertEquals(0, num(diag, "bid_sz"), 0.0);
        assertTrue(sink.ofType(EventType.ORDER_FLOW_FOOTPRINT).isEmpty());
    }

    @Test
    void testCrossChartExportsUnderTargetChart() {
        data.addBar(4, bar(5000.0, T0));
        data.addStudy(4, 2, "VWAP (Volume Weighted Average Price)");
        data.setSeries(4, 2, 0, 5000.5);
        data.addBar(3, bar(5000.25, T0 + 5 * MINUTE));

        engine(EngineConfig.builder()
            .features(Feature.CROSS_CHART)
            .crossChart(ES_30M)
            .build()).onUpdate(update());

        EmittedEvent bar = sink.last(EventType.BASEDATA);
        assertEquals(ES_30M, bar.source());
        assertEquals(0, num(bar, "i"), 0.0);
        assertEquals(5000.0, num(bar, "c"), 0.0);
        assertEquals(T0 + 5 * MINUTE, bar.timestampMillis());

        EmittedEvent vwap = sink.last(EventType.VWAP);
        assertEquals(ES_30M, vwap.source());
        assertEquals(5000.5, num(vwap, "v"), 0.0);

        EmittedEvent flow = sink.last(EventType.ORDER_FLOW_DIAG);
        assertEquals(ES_30M, flow.source());
        assertEquals("study_not_found", flow.message());
    }

    @Test
    void testCrossChartSkippedBeforeFirstTargetBar() {
        data.addBar(4, bar(5000.0, T0 + 30 * MINUTE));
        data.addBar(3, bar(5000.25, T0));

        engine(EngineConfig.builder()
            .features(Feature.CROSS_CHART)
            .crossChart(ES_30M)
            .build()).onUpdate(update());

        assertTrue(sink.events().isEmpty());
    }

    @Test
    void testLevelsFallBackToLastNonZeroValue() {
        data.addBar(6, bar(5000.0, T0));
        data.addBar(6, bar(5000.0, T0 + 30 * MINUTE));
        data.setSeries(6, 1, 1, 5100.0, 0.0);
        data.setSeries(6, 1, 2, 4900.0, 4910.0);
        data.addBar(3, bar(5000.25, T0 + 35 * MINUTE));

        LevelOverlaySettings levels = new LevelOverlaySettings(OVERLAY, List.of(
            new LevelStudy(1, 2, LevelRole.GAMMA),
            new LevelStudy(2, 1, LevelRole.SWING)), true);
        ChartEventEngine engine = engine(EngineConfig.builder()
            .features(Feature.LEVELS)
            .levels(levels)
            .build());
        engine.onUpdate(update());

        List<EmittedEvent> levelEvents = sink.ofType(EventType.LEVEL);
        assertEquals(2, levelEvents.size());

        EmittedEvent callResistance = levelEvents.get(0);
        assertEquals(OVERLAY, callResistance.source());
        assertEquals("call_resistance", callResistance.field("level_type"));
        assertEquals(5100.0, num(callResistance, "price"), 0.0);
        assertEquals(0, num(callResistance, "bar"), 0.0);

        EmittedEvent putSupport = levelEvents.get(1);
        assertEquals("put_support", putSupport.field("level_type"));
        assertEquals(4910.0, num(putSupport, "price"), 0.0);
        assertEquals(1, num(putSupport, "bar"), 0.0);

        EmittedEvent diag = sink.last(EventType.LEVEL_DIAG);
        assertEquals("no_value", diag.message());
        assertEquals(2, num(diag, "study"), 0.0);
        assertEquals(1, num(diag, "sg"), 0.0);

        engine.onUpdate(update());
        assertEquals(3, sink.events().size());
    }

    @Test
    void testIndexFromChart() {
        data.setTickSize(8, 0.01);
        data.addBar(8, Bar.of(15.2, 15.6, 15.1, 15.47, 0, T0));
        data.addBar(3, bar(5000.0, T0 + MINUTE));

        engine(EngineConfig.builder()
            .features(Feature.INDEX)
            .index(IndexSettings.fromChart(VIX))
            .build()).onUpdate(update());

        EmittedEvent vix = sink.last(EventType.INDEX);
        assertEquals(15.47, num(vix, "last"), 1e-12);
        assertEquals(0, num(vix, "mode"), 0.0);
    }

    @Test
    void testIndexFromMissingStudy() {
        data.addBar(3, bar(5000.0, T0));

        engine(EngineConfig.builder()
            .features(Feature.INDEX)
            .index(IndexSettings.fromStudy(4, 0))
            .build()).onUpdate(update());

        EmittedEvent diag = sink.last(EventType.INDEX_DIAG);
        assertEquals("no_data", diag.message());
        assertEquals(1, num(diag, "mode"), 0.0);
        assertEquals(4, num(diag, "study"), 0.0);
    }

    @Test
    void testRejectedWriteIsRetried() {
        data.addBar(3, bar(5000.0, T0));
        ChartEventEngine engine = engine(Feature.BASEDATA);

        sink.setAccept(false);
        engine.onUpdate(update());
        sink.setAccept(true);
        engine.onUpdate(update());

        assertEquals(1, sink.ofType(EventType.BASEDATA).size());
        assertEquals(1, listener.emitted);
    }

    /**
     * Delegates to another source but fails every volume-at-price read.
     */
    private static final class BrokenVolumeAtPriceSource implements MarketDataSource {
        private final MarketDataSource delegate;

        BrokenVolumeAtPriceSource(MarketDataSource delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean isConnected(SourceId source) {
            return delegate.isConnected(source);
        }

        @Override
        public int barCount(SourceId source) {
            return delegate.barCount(source);
        }

        @Override
        public Bar bar(SourceId source, int index) {
            return delegate.bar(source, index);
        }

        @Override
        public boolean isSessionStart(SourceId source, int index) {
            return delegate.isSessionStart(source, index);
        }

        @Override
        public List<PriceVolume> volumeAtPrice(SourceId source, int index) {
            throw new IllegalStateException("volume at price unavailable");
        }

        @Override
        public Quote bestQuote(SourceId source) {
            return delegate.bestQuote(source);
        }

        @Override
        public Optional<DepthEntry> depthLevel(SourceId source, BookSide side, int level) {
            return delegate.depthLevel(source, side, level);
        }

        @Override
        public OptionalInt findStudyId(SourceId source, String studyName) {
            return delegate.findStudyId(source, studyName);
        }

        @Override
        public Optional<StudySeries> studySeries(SourceId source, int studyId, int subgraph) {
            return delegate.studySeries(source, studyId, subgraph);
        }

        @Override
        public List<TimeAndSalesRecord> timeAndSales(SourceId source) {
            return delegate.timeAndSales(source);
        }

        @Override
        public double tickSize(SourceId source) {
            return delegate.tickSize(source);
        }

        @Override
        public double realTimeMultiplier(SourceId source) {
            return delegate.realTimeMultiplier(source);
        }
    }
}
