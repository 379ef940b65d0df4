package io.trading.dumper.config;

import io.trading.marketevent.engine.EngineConfig;
import io.trading.marketevent.engine.IndexSettings;
import io.trading.marketevent.engine.LevelOverlaySettings;
import io.trading.marketevent.engine.SessionStatsSettings;
import io.trading.marketevent.engine.VwapSettings;
import io.trading.marketevent.model.SourceId;
import io.trading.marketevent.normalize.NormalizerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the Chart Dumper.
 *
 * @param dumperId       Unique dumper instance identifier
 * @param outputDir      Directory receiving the JSON-lines partitions
 * @param logZone        Zone deciding the day of a partition
 * @param charts         Charts to run a pipeline for
 * @param depthLevels    Book levels exported per side
 * @param vwapBands      VWAP band pairs exported (0..4)
 * @param pvwapBands     Previous-session sigma bands exported (0..4)
 * @param scaleThreshold Prices above this are treated as scaled by 100
 * @param scalePasses    Rescale-then-round passes of the normalizer
 * @param crossCharts    Coarser charts exported at the aligned bar of every pipeline
 * @param vixChart       Index chart, null when not configured
 * @param levelsChart    Level overlay chart, null when not configured
 * @param sourceProvider Name of the market data source provider
 * @param pollMs         Interval of synthetic updates for every chart, 0 to rely on host notifications
 * @param healthCheckMs  Health check interval in milliseconds
 * @param staleAfterMs   A connected chart without updates for this long is reported stale
 * @param metricsPort    Port for Prometheus metrics HTTP server, 0 for any free port
 * @param aeronEnabled   Mirror every written line to Aeron
 * @param aeronDir       Aeron directory for media driver
 */
public record DumperConfig(
    String dumperId,
    String outputDir,
    ZoneId logZone,
    List<ChartConfig> charts,
    int depthLevels,
    int vwapBands,
    int pvwapBands,
    double scaleThreshold,
    int scalePasses,
    List<SourceId> crossCharts,
    SourceId vixChart,
    SourceId levelsChart,
    String sourceProvider,
    int pollMs,
    int healthCheckMs,
    int staleAfterMs,
    int metricsPort,
    boolean aeronEnabled,
    String aeronDir
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(DumperConfig.class);

    private static final String DEFAULT_DUMPER_ID = "dumper-0";
    private static final String DEFAULT_OUTPUT_DIR = "data/events";
    private static final String DEFAULT_CHARTS = "3:ESU25_FUT_CME";
    private static final String DEFAULT_SOURCE_PROVIDER = "memory";
    private static final int DEFAULT_DEPTH_LEVELS = 10;
    private static final int DEFAULT_VWAP_BANDS = 2;
    private static final int DEFAULT_PVWAP_BANDS = 2;
    private static final double DEFAULT_SCALE_THRESHOLD = 10_000.0;
    private static final int DEFAULT_SCALE_PASSES = 2;
    private static final int DEFAULT_POLL_MS = 0;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_STALE_AFTER_MS = 60_000;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public DumperConfig {
        if (dumperId == null || dumperId.isEmpty()) {
            throw new IllegalArgumentException("dumperId cannot be null or empty");
        }
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("outputDir cannot be null or empty");
        }
        if (logZone == null) {
            throw new IllegalArgumentException("logZone cannot be null");
        }
        if (charts == null || charts.isEmpty()) {
            throw new IllegalArgumentException("charts cannot be null or empty");
        }
        Set<Integer> seen = new HashSet<>();
        for (ChartConfig chart : charts) {
            if (!seen.add(chart.chart())) {
                throw new IllegalArgumentException("chart " + chart.chart() + " configured twice");
            }
        }
        if (depthLevels < 1 || depthLevels > 255) {
            throw new IllegalArgumentException("depthLevels must be between 1 and 255");
        }
        if (vwapBands < 0 || vwapBands > VwapSettings.MAX_BANDS) {
            throw new IllegalArgumentException("vwapBands must be between 0 and " + VwapSettings.MAX_BANDS);
        }
        if (pvwapBands < 0 || pvwapBands > VwapSettings.MAX_BANDS) {
            throw new IllegalArgumentException("pvwapBands must be between 0 and " + VwapSettings.MAX_BANDS);
        }
        if (!(scaleThreshold > 0.0)) {
            throw new IllegalArgumentException("scaleThreshold must be positive");
        }
        if (scalePasses < 1) {
            throw new IllegalArgumentException("scalePasses must be at least 1");
        }
        if (sourceProvider == null || sourceProvider.isEmpty()) {
            throw new IllegalArgumentException("sourceProvider cannot be null or empty");
        }
        if (pollMs < 0) {
            throw new IllegalArgumentException("pollMs cannot be negative");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (staleAfterMs <= 0) {
            throw new IllegalArgumentException("staleAfterMs must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        if (aeronDir == null || aeronDir.isEmpty()) {
            throw new IllegalArgumentException("aeronDir cannot be null or empty");
        }
        charts = List.copyOf(charts);
        crossCharts = crossCharts == null ? List.of() : List.copyOf(crossCharts);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - DUMPER_ID: Dumper instance ID (default: "dumper-0")
     * - OUTPUT_DIR: Log directory (default: "data/events")
     * - LOG_ZONE: Zone of the daily partitions (default: "UTC")
     * - CHARTS: Chart configs (e.g., "3:ESU25_FUT_CME:basedata,vwap;4:NQU25_FUT_CME")
     * - DEPTH_LEVELS: Book levels per side (default: 10)
     * - VWAP_BANDS, PVWAP_BANDS: Band pairs (default: 2)
     * - SCALE_THRESHOLD, SCALE_PASSES: Price scale correction (default: 10000, 2)
     * - CROSS_CHARTS: Coarser charts (e.g., "5:ESU25_FUT_CME,6:ESU25_FUT_CME")
     * - VIX_CHART: Index chart (e.g., "8:VIX")
     * - LEVELS_CHART: Level overlay chart (e.g., "7:ESU25_FUT_CME")
     * - SOURCE_PROVIDER: Market data source provider name (default: "memory")
     * - POLL_MS: Synthetic update interval, 0 to disable (default: 0)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - STALE_AFTER_MS: Staleness threshold (default: 60000)
     * - METRICS_PORT: HTTP port (default: 9090)
     * - AERON_ENABLED: Mirror lines to Aeron (default: false)
     * - AERON_DIR: Aeron directory (default: "/dev/shm/chart-dumper-{dumperId}")
     */
    public static DumperConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Loads configuration from a map of environment-style variables.
     */
    public static DumperConfig fromMap(Map<String, String> env) {
        Function<String, String> get = key -> {
            String value = env.get(key);
            return value == null || value.isEmpty() ? null : value;
        };

        String dumperId = orDefault(get.apply("DUMPER_ID"), DEFAULT_DUMPER_ID);
        String outputDir = orDefault(get.apply("OUTPUT_DIR"), DEFAULT_OUTPUT_DIR);
        String aeronDir = orDefault(get.apply("AERON_DIR"), "/dev/shm/chart-dumper-" + dumperId);
        String chartsStr = orDefault(get.apply("CHARTS"), DEFAULT_CHARTS);

        ZoneId logZone = ZoneId.of("UTC");
        String zoneStr = get.apply("LOG_ZONE");
        if (zoneStr != null) {
            try {
                logZone = ZoneId.of(zoneStr);
            } catch (DateTimeException e) {
                LOGGER.warn("Invalid LOG_ZONE value: {}, using default: {}", zoneStr, logZone);
            }
        }

        List<ChartConfig> charts = Arrays.stream(chartsStr.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(ChartConfig::fromString)
            .collect(Collectors.toList());

        List<SourceId> crossCharts = new ArrayList<>();
        String crossStr = get.apply("CROSS_CHARTS");
        if (crossStr != null) {
            crossCharts = Arrays.stream(crossStr.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(ChartConfig::parseSource)
                .collect(Collectors.toList());
        }

        String vixStr = get.apply("VIX_CHART");
        String levelsStr = get.apply("LEVELS_CHART");

        return new DumperConfig(
            dumperId,
            outputDir,
            logZone,
            charts,
            parseInt(get, "DEPTH_LEVELS", DEFAULT_DEPTH_LEVELS),
            parseInt(get, "VWAP_BANDS", DEFAULT_VWAP_BANDS),
            parseInt(get, "PVWAP_BANDS", DEFAULT_PVWAP_BANDS),
            parseDouble(get, "SCALE_THRESHOLD", DEFAULT_SCALE_THRESHOLD),
            parseInt(get, "SCALE_PASSES", DEFAULT_SCALE_PASSES),
            crossCharts,
            vixStr != null ? ChartConfig.parseSource(vixStr) : null,
            levelsStr != null ? ChartConfig.parseSource(levelsStr) : null,
            orDefault(get.apply("SOURCE_PROVIDER"), DEFAULT_SOURCE_PROVIDER),
            parseInt(get, "POLL_MS", DEFAULT_POLL_MS),
            parseInt(get, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            parseInt(get, "STALE_AFTER_MS", DEFAULT_STALE_AFTER_MS),
            parseInt(get, "METRICS_PORT", DEFAULT_METRICS_PORT),
            Boolean.parseBoolean(get.apply("AERON_ENABLED")),
            aeronDir
        );
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static int parseInt(Function<String, String> get, String key, int defaultValue) {
        String value = get.apply(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(Function<String, String> get, String key, double defaultValue) {
        String value = get.apply(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Builds the engine configuration of one chart.
     * The chart is never its own cross chart, and the index chart gets no index export.
     */
    public EngineConfig engineConfig(ChartConfig chart) {
        NormalizerSettings normalizer = NormalizerSettings.defaults()
            .withScaleThreshold(scaleThreshold)
            .withPasses(scalePasses);

        EngineConfig.Builder builder = EngineConfig.builder()
            .features(chart.features())
            .normalizer(normalizer)
            .maxDepthLevels(depthLevels)
            .vwap(new VwapSettings(0, vwapBands))
            .sessionStats(new SessionStatsSettings(pvwapBands, true));

        if (vixChart != null && vixChart.chart() != chart.chart()) {
            builder.index(IndexSettings.fromChart(vixChart));
        }
        if (levelsChart != null) {
            builder.levels(LevelOverlaySettings.standard(levelsChart));
        }
        for (SourceId cross : crossCharts) {
            if (cross.chart() != chart.chart()) {
                builder.crossChart(cross);
            }
        }
        return builder.build();
    }

    /**
     * Creates a new builder for DumperConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for DumperConfig.
     */
    public static class Builder {
        private String dumperId = DEFAULT_DUMPER_ID;
        private String outputDir = DEFAULT_OUTPUT_DIR;
        private ZoneId logZone = ZoneId.of("UTC");
        private final List<ChartConfig> charts = new ArrayList<>();
        private int depthLevels = DEFAULT_DEPTH_LEVELS;
        private int vwapBands = DEFAULT_VWAP_BANDS;
        private int pvwapBands = DEFAULT_PVWAP_BANDS;
        private double scaleThreshold = DEFAULT_SCALE_THRESHOLD;
        private int scalePasses = DEFAULT_SCALE_PASSES;
        private final List<SourceId> crossCharts = new ArrayList<>();
        private SourceId vixChart;
        private SourceId levelsChart;
        private String sourceProvider = DEFAULT_SOURCE_PROVIDER;
        private int pollMs = DEFAULT_POLL_MS;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int staleAfterMs = DEFAULT_STALE_AFTER_MS;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private boolean aeronEnabled = false;
        private String aeronDir;

        public Builder dumperId(String dumperId) {
            this.dumperId = dumperId;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder logZone(ZoneId logZone) {
            this.logZone = logZone;
            return this;
        }

        public Builder addChart(ChartConfig chart) {
            this.charts.add(chart);
            return this;
        }

        public Builder depthLevels(int depthLevels) {
            this.depthLevels = depthLevels;
            return this;
        }

        public Builder vwapBands(int vwapBands) {
            this.vwapBands = vwapBands;
            return this;
        }

        public Builder pvwapBands(int pvwapBands) {
            this.pvwapBands = pvwapBands;
            return this;
        }

        public Builder scaleThreshold(double scaleThreshold) {
            this.scaleThreshold = scaleThreshold;
            return this;
        }

        public Builder scalePasses(int scalePasses) {
            this.scalePasses = scalePasses;
            return this;
        }

        public Builder addCrossChart(SourceId chart) {
            this.crossCharts.add(chart);
            return this;
        }

        public Builder vixChart(SourceId vixChart) {
            this.vixChart = vixChart;
            return this;
        }

        public Builder levelsChart(SourceId levelsChart) {
            this.levelsChart = levelsChart;
            return this;
        }

        public Builder sourceProvider(String sourceProvider) {
            this.sourceProvider = sourceProvider;
            return this;
        }

        public Builder pollMs(int pollMs) {
            this.pollMs = pollMs;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder staleAfterMs(int staleAfterMs) {
            this.staleAfterMs = staleAfterMs;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder aeronEnabled(boolean aeronEnabled) {
            this.aeronEnabled = aeronEnabled;
            return this;
        }

        public Builder aeronDir(String aeronDir) {
            this.aeronDir = aeronDir;
            return this;
        }

        public DumperConfig build() {
            if (aeronDir == null || aeronDir.isEmpty()) {
                aeronDir = "/dev/shm/chart-dumper-" + dumperId;
            }
            if (charts.isEmpty()) {
                throw new IllegalStateException("At least one chart config must be added");
            }
            return new DumperConfig(
                dumperId,
                outputDir,
                logZone,
                List.copyOf(charts),
                depthLevels,
                vwapBands,
                pvwapBands,
                scaleThreshold,
                scalePasses,
                List.copyOf(crossCharts),
                vixChart,
                levelsChart,
                sourceProvider,
                pollMs,
                healthCheckMs,
                staleAfterMs,
                metricsPort,
                aeronEnabled,
                aeronDir
            );
        }
    }
}
