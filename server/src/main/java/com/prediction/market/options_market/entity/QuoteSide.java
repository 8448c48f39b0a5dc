package com.prediction.market.options_market.entity;

public enum QuoteSide {
    BID,
    ASK,
    MID
}
