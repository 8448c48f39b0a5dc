package com.prediction.market.options_market.entity;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionSummary {
    double strike;
    int quantity;
    Money averageCost;
    double currentPrice;
    Money positionValue;
    Money unrealizedPnl;
    Money costBasis;
    PositionStatus status;
    Money settlementValue;
}
