package com.prediction.market.options_market.engine;

public enum SimulationMode {
    /** Points are produced only by explicit {@code step()} calls. */
    MANUAL,
    /** A background worker produces one point per interval. */
    AUTO
}
