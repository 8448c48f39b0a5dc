package com.prediction.market.options_market.export;

import com.prediction.market.options_market.entity.PricePoint;

/**
 * Append-only sink for the points of one simulation run.
 *
 * Implementations must not throw: a recording failure is logged and must
 * never stop price generation.
 */
public interface PricePointRecorder {

    void open(boolean resolvedOutcome, int totalPoints);

    void record(PricePoint point);

    /**
     * Finalizes the record. Calls after the first are no-ops.
     */
    void close();
}
