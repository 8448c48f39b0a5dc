package com.prediction.market.options_market.service;

import java.util.List;

import com.prediction.market.options_market.entity.Money;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LedgerSettings {

    @Builder.Default
    List<Double> strikes = List.of(0.3, 0.4, 0.5, 0.6, 0.7, 0.8);

    /**
     * Share of current cash one position may tie up at the ask.
     */
    @Builder.Default
    double maxPositionFraction = 0.2;

    /**
     * Contracts always allowed regardless of cash.
     */
    @Builder.Default
    int minLiquidity = 10;

    @Builder.Default
    double decayRate = 1.5;

    @Builder.Default
    Money defaultStartingCash = Money.of(15_000L);

    public static LedgerSettings defaults() {
        return builder().build();
    }

    public void validate() {
        if (strikes == null || strikes.isEmpty()) {
            throw new IllegalArgumentException("At least one strike is required");
        }
        for (Double strike : strikes) {
            if (strike == null || !(strike > 0.0 && strike < 1.0)) {
                throw new IllegalArgumentException("Strike must be in (0,1): " + strike);
            }
        }
        if (!(maxPositionFraction > 0.0 && maxPositionFraction <= 1.0)) {
            throw new IllegalArgumentException("maxPositionFraction must be in (0,1]: " + maxPositionFraction);
        }
        if (minLiquidity < 0) {
            throw new IllegalArgumentException("minLiquidity must be >= 0: " + minLiquidity);
        }
        if (decayRate < 0 || !Double.isFinite(decayRate)) {
            throw new IllegalArgumentException("decayRate must be a finite value >= 0: " + decayRate);
        }
        if (defaultStartingCash == null || defaultStartingCash.isNegative()) {
            throw new IllegalArgumentException("defaultStartingCash must be >= 0");
        }
    }
}
