package com.prediction.market.options_market.engine;

import com.prediction.market.options_market.entity.PricePoint;

/**
 * Receives every point the simulation emits.
 *
 * Called synchronously on the producing thread, in subscription order, so
 * implementations must return quickly. Wrap slow consumers in a
 * {@link com.prediction.market.options_market.execution.QueuedPriceSink}.
 */
@FunctionalInterface
public interface PriceSink {

    void onPrice(PricePoint point);
}
