package io.trading.marketevent.engine;

import java.util.Locale;

/**
 * Collectors that can be enabled per source, in execution order.
 */
public enum Feature {
    BASEDATA("basedata"),
    VWAP("vwap"),
    VALUE_AREA("value_area"),
    PREVIOUS_SESSION("previous_session"),
    CROSS_CHART("cross_chart"),
    INDEX("index"),
    LEVELS("levels"),
    ORDER_FLOW("order_flow"),
    QUOTES("quotes"),
    TRADES("trades"),
    DEPTH("depth"),
    TIME_AND_SALES("time_and_sales");

    private final String key;

    Feature(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Parses a feature from its key (e.g., "order_flow") or enum name, ignoring case.
     */
    public static Feature fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Feature feature : values()) {
            if (feature.key.equals(normalized) || feature.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown feature: " + value);
    }
}
