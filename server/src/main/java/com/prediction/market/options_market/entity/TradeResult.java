package com.prediction.market.options_market.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a trade request. Business-rule rejections are results, not
 * exceptions; the message always says why.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeResult {
    private final boolean success;
    private final String message;
    private final Trade trade;

    public static TradeResult executed(Trade trade) {
        return new TradeResult(true, "Trade executed successfully", trade);
    }

    public static TradeResult rejected(String reason) {
        return new TradeResult(false, reason, null);
    }
}
