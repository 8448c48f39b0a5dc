package com.prediction.market.options_market.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A user's holding in one strike.
 *
 * netQuantity and costBasis are never adjusted independently: every change
 * to the trade list recomputes both from the list, so they always equal the
 * fold of the position's trades. Not thread-safe; the ledger guards each
 * user's positions with that user's lock.
 */
@Getter
public class Position {

    private final String userId;
    private final double strike;
    private final List<Trade> trades = new ArrayList<>();

    private int netQuantity;
    private Money costBasis = Money.ZERO;
    private PositionStatus status = PositionStatus.OPEN;
    private Money settlementValue = Money.ZERO;

    public Position(String userId, double strike) {
        this.userId = userId;
        this.strike = strike;
    }

    public void addTrade(Trade trade) {
        if (status != PositionStatus.OPEN) {
            throw new IllegalStateException(
                String.format("Position %s@%s is %s, cannot add trades", userId, strike, status));
        }
        trades.add(trade);
        recompute();
    }

    /**
     * Removes a trade that was applied but could not be made durable.
     */
    public boolean removeTrade(Trade trade) {
        boolean removed = trades.remove(trade);
        if (removed) {
            recompute();
        }
        return removed;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    /**
     * Average cost per contract, zero when flat.
     */
    public Money getAverageCostPerContract() {
        if (netQuantity == 0) {
            return Money.ZERO;
        }
        return costBasis.divide(Math.abs(netQuantity));
    }

    /**
     * Mark-to-market P&L at the given option price; zero once settled.
     */
    public Money unrealizedPnl(double currentOptionPrice) {
        if (status != PositionStatus.OPEN) {
            return Money.ZERO;
        }
        return Money.ofContracts(currentOptionPrice, netQuantity).subtract(costBasis);
    }

    /**
     * Settles with a call payoff max(finalPrice/100 - strike, 0).
     * A settled position returns its stored value and does not change.
     */
    public Money settle(double finalMarketPrice) {
        if (status != PositionStatus.OPEN) {
            return settlementValue;
        }
        double payoff = Math.max(finalMarketPrice / 100.0 - strike, 0.0);
        settlementValue = Money.ofContracts(payoff, netQuantity);
        status = PositionStatus.SETTLED;
        return settlementValue;
    }

    public boolean isFlat() {
        return netQuantity == 0;
    }

    private void recompute() {
        int quantity = 0;
        Money basis = Money.ZERO;
        for (Trade trade : trades) {
            quantity += trade.signedQuantity();
            basis = basis.add(trade.getSignedTotalCost());
        }
        this.netQuantity = quantity;
        this.costBasis = basis;
    }
}
