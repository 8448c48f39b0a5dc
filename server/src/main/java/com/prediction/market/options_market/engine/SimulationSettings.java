package com.prediction.market.options_market.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of the price process. Defaults describe a 1500 point market
 * that starts at 50 and trends toward its outcome over the last 30%.
 */
@Value
@Builder(toBuilder = true)
public class SimulationSettings {

    public static final double MIN_INITIAL_PRICE = 15.0;
    public static final double MAX_INITIAL_PRICE = 85.0;

    @Builder.Default
    int totalPoints = 1500;

    @Builder.Default
    double initialPrice = 50.0;

    @Builder.Default
    double volatility = 1.8;

    /**
     * Fraction of the run after which the trend toward the outcome starts.
     */
    @Builder.Default
    double thresholdFraction = 0.7;

    @Builder.Default
    double trendStrength = 0.08;

    @Builder.Default
    double maxMovementPerStep = 4.0;

    /**
     * Fixed outcome, or null to draw it at random.
     */
    Boolean forcedOutcome;

    public static SimulationSettings defaults() {
        return builder().build();
    }

    /**
     * @throws IllegalArgumentException when a parameter is out of range
     */
    public void validate() {
        if (totalPoints <= 0) {
            throw new IllegalArgumentException("totalPoints must be positive: " + totalPoints);
        }
        if (!Double.isFinite(initialPrice)) {
            throw new IllegalArgumentException("initialPrice must be finite: " + initialPrice);
        }
        if (!(volatility >= 0) || !Double.isFinite(volatility)) {
            throw new IllegalArgumentException("volatility must be >= 0: " + volatility);
        }
        if (!(thresholdFraction > 0 && thresholdFraction < 1)) {
            throw new IllegalArgumentException("thresholdFraction must be in (0,1): " + thresholdFraction);
        }
        if (!(trendStrength >= 0) || !Double.isFinite(trendStrength)) {
            throw new IllegalArgumentException("trendStrength must be >= 0: " + trendStrength);
        }
        if (!(maxMovementPerStep > 0) || !Double.isFinite(maxMovementPerStep)) {
            throw new IllegalArgumentException("maxMovementPerStep must be positive: " + maxMovementPerStep);
        }
    }

    public double clampedInitialPrice() {
        return Math.max(MIN_INITIAL_PRICE, Math.min(MAX_INITIAL_PRICE, initialPrice));
    }
}
