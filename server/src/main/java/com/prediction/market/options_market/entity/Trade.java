package com.prediction.market.options_market.entity;

import java.time.Instant;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * An executed option trade.
 *
 * Trades are append-only facts: there are no setters, and positions and cash
 * are derived from them. The trade log is the source of truth that the
 * ledger replays at startup.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "trades")
@CompoundIndex(name = "user_timestamp_idx", def = "{'userId':1,'timestamp':1}")
public class Trade {

    @MongoId
    private String id;

    private String userId;
    private Instant timestamp;
    private TradeSide side;
    private double strike;
    private int quantity;
    private double pricePerContract;

    /**
     * Positive for BUY (cash outflow), negative for SELL (cash inflow).
     */
    private Money signedTotalCost;

    /**
     * Underlying price (0-100) when the trade was made.
     */
    private double underlyingPriceAtTrade;

    /**
     * Signed contract delta this trade applies to its position.
     */
    public int signedQuantity() {
        return side.sign() * quantity;
    }
}
