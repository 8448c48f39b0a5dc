package com.prediction.market.options_market.entity;

import java.util.List;
import java.util.Optional;

import lombok.Value;

/**
 * Complete set of option quotes computed from a single underlying price.
 * A new set replaces the previous one as a whole.
 */
@Value
public class QuoteSet {

    /**
     * Strikes are configured decimals; lookups tolerate representation noise.
     */
    private static final double STRIKE_TOLERANCE = 1e-9;

    long sequenceIndex;
    double underlyingPrice;
    List<OptionQuote> quotes;

    public QuoteSet(long sequenceIndex, double underlyingPrice, List<OptionQuote> quotes) {
        this.sequenceIndex = sequenceIndex;
        this.underlyingPrice = underlyingPrice;
        this.quotes = List.copyOf(quotes);
    }

    public Optional<OptionQuote> find(double strike) {
        for (OptionQuote quote : quotes) {
            if (Math.abs(quote.getStrike() - strike) < STRIKE_TOLERANCE) {
                return Optional.of(quote);
            }
        }
        return Optional.empty();
    }
}
