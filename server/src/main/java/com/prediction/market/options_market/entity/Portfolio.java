package com.prediction.market.options_market.entity;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Point-in-time valuation of one user's account.
 */
@Value
@Builder
public class Portfolio {
    String userId;
    String username;
    Money startingCash;
    Money cash;
    Money totalPositionValue;
    Money totalPortfolioValue;
    Money totalUnrealizedPnl;
    Money totalRealizedPnl;
    Money totalPnl;
    @Singular
    List<PositionSummary> positions;
}
