package io.trading.marketevent.model;

/**
 * Event kinds written to the event log. The tag is the {@code type} field
 * downstream consumers dispatch on and must never change meaning.
 */
public enum EventType {
    BASEDATA("basedata"),
    QUOTE("quote"),
    TRADE("trade"),
    DEPTH("depth"),
    VWAP("vwap"),
    VWAP_DIAG("vwap_diag"),
    VALUE_AREA("vva"),
    VALUE_AREA_DIAG("vva_diag"),
    PREVIOUS_SESSION("pvwap"),
    PREVIOUS_SESSION_DIAG("pvwap_diag"),
    ORDER_FLOW_FOOTPRINT("nbcv_footprint"),
    ORDER_FLOW_METRICS("nbcv_metrics"),
    ORDER_FLOW_IMBALANCE("nbcv_orderflow"),
    ORDER_FLOW_DIAG("nbcv_diag"),
    INDEX("vix"),
    INDEX_DIAG("vix_diag"),
    LEVEL("menthorq_level"),
    LEVEL_DIAG("menthorq_diag"),
    TIME_AND_SALES_DIAG("ts_diag");

    private final String tag;

    EventType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Returns true for records that carry a {@code msg} instead of data.
     */
    public boolean isDiagnostic() {
        return tag.endsWith("_diag");
    }

    @Override
    public String toString() {
        return tag;
    }
}
