package io.trading.dumper.config;

import io.trading.marketevent.engine.Feature;
import io.trading.marketevent.model.SourceId;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for a single chart.
 *
 * @param source   Chart number and symbol
 * @param features Collectors enabled for the chart
 */
public record ChartConfig(
    SourceId source,
    Set<Feature> features
) {
    public ChartConfig {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (features == null || features.isEmpty()) {
            throw new IllegalArgumentException("features cannot be null or empty");
        }
        features = Set.copyOf(features);
    }

    /**
     * Parses a chart configuration string.
     * Format: "CHART:SYMBOL" (all features) or "CHART:SYMBOL:feature1,feature2"
     * Example: "3:ESU25_FUT_CME:basedata,vwap,order_flow"
     */
    public static ChartConfig fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2 && parts.length != 3) {
            throw new IllegalArgumentException("Invalid chart config format: " + value);
        }

        SourceId source = new SourceId(parseChart(parts[0], value), parts[1].trim());
        if (parts.length == 2 || parts[2].isBlank()) {
            return new ChartConfig(source, EnumSet.allOf(Feature.class));
        }

        Set<Feature> features = Arrays.stream(parts[2].split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Feature::fromString)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Feature.class)));

        return new ChartConfig(source, features);
    }

    /**
     * Parses a chart reference.
     * Format: "CHART:SYMBOL"
     * Example: "8:VIX"
     */
    public static SourceId parseSource(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid chart reference: " + value);
        }
        return new SourceId(parseChart(parts[0], value), parts[1].trim());
    }

    private static int parseChart(String chart, String value) {
        try {
            return Integer.parseInt(chart.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chart number in: " + value, e);
        }
    }

    public int chart() {
        return source.chart();
    }
}
