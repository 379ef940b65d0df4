package io.trading.marketevent.source;

import io.trading.marketevent.api.MarketDataSource;
import io.trading.marketevent.api.StudySeries;
import io.trading.marketevent.model.Bar;
import io.trading.marketevent.model.BookSide;
import io.trading.marketevent.model.DepthEntry;
import io.trading.marketevent.model.PriceVolume;
import io.trading.marketevent.model.Quote;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.model.TimeAndSalesRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Market data source backed by memory, filled by a host bridge that pushes data.
 *
 * Charts are keyed by chart number, so lookups work with any symbol. Each chart
 * is guarded by its own monitor: a writer thread may update a chart while its
 * pipeline thread reads it. Reads of lists return snapshots.
 */
public final class InMemoryMarketDataSource implements MarketDataSource {

    private static final double DEFAULT_TICK_SIZE = 0.25;

    private final Map<Integer, ChartData> charts = new ConcurrentHashMap<>();

    private ChartData chart(SourceId source) {
        return charts.computeIfAbsent(source.chart(), c -> new ChartData());
    }

    private ChartData chart(int chart) {
        return charts.computeIfAbsent(chart, c -> new ChartData());
    }

    // ---- host side ----

    public void setConnected(int chart, boolean connected) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.connected = connected;
        }
    }

    public void setTickSize(int chart, double tickSize) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.tickSize = tickSize;
        }
    }

    public void setRealTimeMultiplier(int chart, double multiplier) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.multiplier = multiplier;
        }
    }

    /**
     * Appends a bar.
     *
     * @param sessionStart Whether the bar opens a new session
     * @param vap          Volume-at-price elements of the bar
     * @return index of the new bar
     */
    public int addBar(int chart, Bar bar, boolean sessionStart, List<PriceVolume> vap) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.bars.add(bar);
            data.sessionStarts.add(sessionStart);
            data.volumeAtPrice.add(List.copyOf(vap));
            return data.bars.size() - 1;
        }
    }

    public int addBar(int chart, Bar bar) {
        return addBar(chart, bar, false, List.of());
    }

    /**
     * Replaces the latest bar, as the host does while a bar is still forming.
     */
    public void updateLastBar(int chart, Bar bar) {
        ChartData data = chart(chart);
        synchronized (data) {
            if (data.bars.isEmpty()) {
                throw new IllegalStateException("chart " + chart + " has no bars");
            }
            data.bars.set(data.bars.size() - 1, bar);
        }
    }

    public void setQuote(int chart, Quote quote) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.quote = quote;
        }
    }

    /**
     * Sets the book entry at a 1-based level.
     */
    public void setDepth(int chart, BookSide side, int level, DepthEntry entry) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1");
        }
        ChartData data = chart(chart);
        synchronized (data) {
            data.depth.put(side.name() + level, entry);
        }
    }

    public void clearDepth(int chart) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.depth.clear();
        }
    }

    /**
     * Registers a study under a display name.
     */
    public void addStudy(int chart, int studyId, String name) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.studyNames.put(name, studyId);
        }
    }

    /**
     * Sets a study subgraph array; the study exists from then on even without a name.
     */
    public void setSeries(int chart, int studyId, int subgraph, double... values) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.series.put(seriesKey(studyId, subgraph), values.clone());
        }
    }

    public void appendTimeAndSales(int chart, TimeAndSalesRecord... records) {
        ChartData data = chart(chart);
        synchronized (data) {
            data.timeAndSales.addAll(Arrays.asList(records));
        }
    }

    /**
     * Drops all but the newest {@code keep} records, as the host does when it purges its log.
     */
    public void purgeTimeAndSales(int chart, int keep) {
        ChartData data = chart(chart);
        synchronized (data) {
            int size = data.timeAndSales.size();
            if (keep < size) {
                data.timeAndSales.subList(0, size - keep).clear();
            }
        }
    }

    // ---- MarketDataSource ----

    @Override
    public boolean isConnected(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.connected;
        }
    }

    @Override
    public int barCount(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.bars.size();
        }
    }

    @Override
    public Bar bar(SourceId source, int index) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.bars.get(index);
        }
    }

    @Override
    public boolean isSessionStart(SourceId source, int index) {
        ChartData data = chart(source);
        synchronized (data) {
            return index >= 0 && index < data.sessionStarts.size() && data.sessionStarts.get(index);
        }
    }

    @Override
    public List<PriceVolume> volumeAtPrice(SourceId source, int index) {
        ChartData data = chart(source);
        synchronized (data) {
            if (index < 0 || index >= data.volumeAtPrice.size()) {
                return List.of();
            }
            return data.volumeAtPrice.get(index);
        }
    }

    @Override
    public Quote bestQuote(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.quote;
        }
    }

    @Override
    public Optional<DepthEntry> depthLevel(SourceId source, BookSide side, int level) {
        ChartData data = chart(source);
        synchronized (data) {
            return Optional.ofNullable(data.depth.get(side.name() + level));
        }
    }

    @Override
    public OptionalInt findStudyId(SourceId source, String studyName) {
        ChartData data = chart(source);
        synchronized (data) {
            Integer id = data.studyNames.get(studyName);
            return id == null ? OptionalInt.empty() : OptionalInt.of(id);
        }
    }

    @Override
    public Optional<StudySeries> studySeries(SourceId source, int studyId, int subgraph) {
        ChartData data = chart(source);
        synchronized (data) {
            double[] values = data.series.get(seriesKey(studyId, subgraph));
            return values == null ? Optional.empty() : Optional.of(StudySeries.of(values.clone()));
        }
    }

    @Override
    public List<TimeAndSalesRecord> timeAndSales(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return List.copyOf(data.timeAndSales);
        }
    }

    @Override
    public double tickSize(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.tickSize;
        }
    }

    @Override
    public double realTimeMultiplier(SourceId source) {
        ChartData data = chart(source);
        synchronized (data) {
            return data.multiplier;
        }
    }

    private static long seriesKey(int studyId, int subgraph) {
        return ((long) studyId << 32) | (subgraph & 0xFFFFFFFFL);
    }

    private static final class ChartData {
        private boolean connected = true;
        private double tickSize = DEFAULT_TICK_SIZE;
        private double multiplier = 1.0;
        private Quote quote = Quote.empty();
        private final List<Bar> bars = new ArrayList<>();
        private final List<Boolean> sessionStarts = new ArrayList<>();
        private final List<List<PriceVolume>> volumeAtPrice = new ArrayList<>();
        private final Map<String, DepthEntry> depth = new HashMap<>();
        private final Map<String, Integer> studyNames = new HashMap<>();
        private final Map<Long, double[]> series = new HashMap<>();
        private final List<TimeAndSalesRecord> timeAndSales = new ArrayList<>();
    }
}
