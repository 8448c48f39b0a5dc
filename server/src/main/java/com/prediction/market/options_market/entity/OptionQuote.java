package com.prediction.market.options_market.entity;

import lombok.Value;

@Value
public class OptionQuote {
    double strike;
    double bid;
    double ask;

    public double getMid() {
        return (bid + ask) / 2.0;
    }

    public double get(QuoteSide side) {
        return switch (side) {
            case BID -> bid;
            case ASK -> ask;
            case MID -> getMid();
        };
    }
}
