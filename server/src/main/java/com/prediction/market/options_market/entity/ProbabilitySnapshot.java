package com.prediction.market.options_market.entity;

import lombok.Value;

/**
 * Yes/no probabilities read off the underlying.
 *
 * The two sides are carried separately so a feed with skewed yes/no quotes
 * can be priced without changing the pricing formula.
 */
@Value
public class ProbabilitySnapshot {
    double yes;
    double no;

    public static ProbabilitySnapshot fromPrice(double underlyingPrice) {
        double yes = underlyingPrice / 100.0;
        return new ProbabilitySnapshot(yes, 1.0 - yes);
    }
}
