package com.prediction.market.options_market.entity;

import java.time.Instant;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Final underlying price of the market. One document per market.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Document(collection = "market_resolution")
public class MarketResolution {

    public static final String MARKET_ID = "market";

    @MongoId
    private String id;

    private double finalPrice;
    private Instant resolvedAt;

    public static MarketResolution of(double finalPrice, Instant resolvedAt) {
        return new MarketResolution(MARKET_ID, finalPrice, resolvedAt);
    }
}
