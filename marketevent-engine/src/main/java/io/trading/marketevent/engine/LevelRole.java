package io.trading.marketevent.engine;

/**
 * Role of a level study on the overlay chart; decides the {@code level_type} label.
 */
public enum LevelRole {
    GAMMA,
    BLIND_SPOT,
    SWING,
    OTHER;

    private static final String[] GAMMA_LABELS = {
        "call_resistance", "put_support", "hvl", "1d_max",
        "call_resistance_0dte", "put_support_0dte", "hvl_0dte"
    };

    private static final int GEX_COUNT = 12;

    /**
     * Label of a 1-based subgraph.
     */
    public String label(int subgraph) {
        return switch (this) {
            case GAMMA -> gammaLabel(subgraph);
            case BLIND_SPOT -> "blind_spot_" + subgraph;
            case SWING -> "swing_lvl_" + subgraph;
            case OTHER -> "sg_" + subgraph;
        };
    }

    private static String gammaLabel(int subgraph) {
        if (subgraph >= 1 && subgraph <= GAMMA_LABELS.length) {
            return GAMMA_LABELS[subgraph - 1];
        }
        int gex = subgraph - GAMMA_LABELS.length;
        if (gex >= 1 && gex <= GEX_COUNT) {
            return "gex_" + gex;
        }
        return "gamma_sg_" + subgraph;
    }
}
