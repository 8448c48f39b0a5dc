package com.prediction.market.options_market.entity;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarketSummary {
    Double currentPrice;
    boolean resolved;
    Double finalPrice;
    List<OptionQuote> quotes;
}
