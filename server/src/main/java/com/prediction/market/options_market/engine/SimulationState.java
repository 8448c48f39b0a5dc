package com.prediction.market.options_market.engine;

/**
 * Lifecycle of a simulation run.
 *
 * STOPPED -> RUNNING <-> PAUSED -> COMPLETED, and RUNNING/PAUSED -> STOPPED
 * on an explicit stop. A halted run stays STOPPED until the engine is reset.
 */
public enum SimulationState {
    STOPPED,
    RUNNING,
    PAUSED,
    COMPLETED;

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
