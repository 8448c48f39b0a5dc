package com.prediction.market.options_market.entity;

public enum TradeSide {
    BUY,
    SELL;

    /**
     * Sign of the position and cash-basis change a trade of this side causes.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
