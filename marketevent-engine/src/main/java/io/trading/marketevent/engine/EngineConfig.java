package io.trading.marketevent.engine;

import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.NormalizerSettings;
import io.trading.marketevent.replay.ReplayCursor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration of one source pipeline.
 *
 * @param features         Enabled collectors
 * @param normalizer       Price scale correction
 * @param maxDepthLevels   Book levels exported per side
 * @param probeWindow      Records scanned when choosing the replay strategy
 * @param vwap             VWAP study
 * @param valueArea        Value-area export
 * @param sessionStats     Previous-session VWAP export
 * @param orderFlow        Order-flow study layout
 * @param index            External index, null when not configured
 * @param levels           Level overlay, null when not configured
 * @param crossCharts      Coarser charts exported at the aligned bar
 */
public record EngineConfig(
    Set<Feature> features,
    NormalizerSettings normalizer,
    int maxDepthLevels,
    int probeWindow,
    VwapSettings vwap,
    ValueAreaSettings valueArea,
    SessionStatsSettings sessionStats,
    OrderFlowSettings orderFlow,
    IndexSettings index,
    LevelOverlaySettings levels,
    List<SourceId> crossCharts
) {
    private static final int DEFAULT_MAX_DEPTH_LEVELS = 10;
    private static final int MAX_DEPTH_LEVELS = 255;

    public EngineConfig {
        if (features == null) {
            throw new IllegalArgumentException("features cannot be null");
        }
        if (normalizer == null || vwap == null || valueArea == null || sessionStats == null || orderFlow == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (maxDepthLevels < 1 || maxDepthLevels > MAX_DEPTH_LEVELS) {
            throw new IllegalArgumentException("maxDepthLevels must be between 1 and " + MAX_DEPTH_LEVELS);
        }
        if (probeWindow < 1) {
            throw new IllegalArgumentException("probeWindow must be positive");
        }
        features = features.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(features));
        crossCharts = List.copyOf(crossCharts);
    }

    public boolean isEnabled(Feature feature) {
        return features.contains(feature);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EngineConfig. All features are enabled unless set otherwise.
     */
    public static class Builder {
        private final EnumSet<Feature> features = EnumSet.allOf(Feature.class);
        private NormalizerSettings normalizer = NormalizerSettings.defaults();
        private int maxDepthLevels = DEFAULT_MAX_DEPTH_LEVELS;
        private int probeWindow = ReplayCursor.DEFAULT_PROBE_WINDOW;
        private VwapSettings vwap = VwapSettings.defaults();
        private ValueAreaSettings valueArea = ValueAreaSettings.defaults();
        private SessionStatsSettings sessionStats = SessionStatsSettings.defaults();
        private OrderFlowSettings orderFlow = OrderFlowSettings.defaults();
        private IndexSettings index;
        private LevelOverlaySettings levels;
        private final List<SourceId> crossCharts = new ArrayList<>();

        public Builder features(Collection<Feature> enabled) {
            features.clear();
            features.addAll(enabled);
            return this;
        }

        public Builder features(Feature first, Feature... rest) {
            return features(EnumSet.of(first, rest));
        }

        public Builder disable(Feature feature) {
            features.remove(feature);
            return this;
        }

        public Builder normalizer(NormalizerSettings normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder maxDepthLevels(int maxDepthLevels) {
            this.maxDepthLevels = maxDepthLevels;
            return this;
        }

        public Builder probeWindow(int probeWindow) {
            this.probeWindow = probeWindow;
            return this;
        }

        public Builder vwap(VwapSettings vwap) {
            this.vwap = vwap;
            return this;
        }

        public Builder valueArea(ValueAreaSettings valueArea) {
            this.valueArea = valueArea;
            return this;
        }

        public Builder sessionStats(SessionStatsSettings sessionStats) {
            this.sessionStats = sessionStats;
            return this;
        }

        public Builder orderFlow(OrderFlowSettings orderFlow) {
            this.orderFlow = orderFlow;
            return this;
        }

        public Builder index(IndexSettings index) {
            this.index = index;
            return this;
        }

        public Builder levels(LevelOverlaySettings levels) {
            this.levels = levels;
            return this;
        }

        public Builder crossChart(SourceId chart) {
            this.crossCharts.add(chart);
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(features, normalizer, maxDepthLevels, probeWindow, vwap, valueArea,
                sessionStats, orderFlow, index, levels, crossCharts);
        }
    }
}
