package com.prediction.market.options_market.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.prediction.market.options_market.entity.OptionQuote;
import com.prediction.market.options_market.entity.ProbabilitySnapshot;

/**
 * Turns the underlying yes/no probabilities into decaying option quotes.
 * Stateless.
 */
public class PricingEngine {

    private static final double MIN_FALLBACK_PRICE = 0.001;
    private static final double FALLBACK_TIME_VALUE = 0.05;

    /**
     * Quotes one strike.
     *
     * @param snapshot     latest yes/no probabilities, null when no underlying exists yet
     * @param strike       strike in (0,1)
     * @param decayRate    exponential decay speed k, at least 0
     * @param elapsedIndex index of the sample being priced
     * @param totalPoints  number of samples in the pricing horizon
     * @return the quote, or empty when there is nothing to price from
     */
    public Optional<OptionQuote> price(ProbabilitySnapshot snapshot, double strike, double decayRate,
            long elapsedIndex, long totalPoints) {
        validateStrike(strike);
        if (decayRate < 0) {
            throw new IllegalArgumentException("Decay rate must be >= 0: " + decayRate);
        }
        if (snapshot == null) {
            return Optional.empty();
        }

        double decay = decayMultiplier(decayRate, elapsedIndex, totalPoints);
        double bid = snapshot.getYes() * (1 - strike) * decay;
        // ask reads the NO side; equal to bid while yes and no come from one price
        double ask = (1 - snapshot.getNo()) * (1 - strike) * decay;
        return Optional.of(new OptionQuote(strike, bid, ask));
    }

    /**
     * Quotes every strike from the same snapshot; empty when the snapshot is missing.
     */
    public List<OptionQuote> quoteAll(ProbabilitySnapshot snapshot, List<Double> strikes, double decayRate,
            long elapsedIndex, long totalPoints) {
        List<OptionQuote> quotes = new ArrayList<>(strikes.size());
        for (double strike : strikes) {
            price(snapshot, strike, decayRate, elapsedIndex, totalPoints).ifPresent(quotes::add);
        }
        return quotes;
    }

    /**
     * exp(-k * elapsed / lastIndex), or 1 when the horizon has a single sample.
     */
    public double decayMultiplier(double decayRate, long elapsedIndex, long totalPoints) {
        if (totalPoints <= 1) {
            return 1.0;
        }
        double lastIndex = totalPoints - 1;
        return Math.exp(-decayRate * (elapsedIndex / lastIndex));
    }

    /**
     * Intrinsic value plus a flat time value, used when a computed quote is not finite.
     *
     * @param underlyingPrice underlying on the 0-100 scale
     */
    public double fallbackPrice(double underlyingPrice, double strike) {
        double intrinsic = Math.max(underlyingPrice / 100.0 - strike, 0.0);
        double timeValue = FALLBACK_TIME_VALUE * (1 - strike);
        return Math.max(MIN_FALLBACK_PRICE, intrinsic + timeValue);
    }

    private static void validateStrike(double strike) {
        if (!(strike > 0.0 && strike < 1.0)) {
            throw new IllegalArgumentException("Strike must be in (0,1): " + strike);
        }
    }
}
