package com.prediction.market.options_market.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Trading account.
 *
 * currentCash changes only through trade execution and settlement.
 * realizedPnl stays zero until the market resolves and is then set to
 * currentCash - startingCash.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "users")
public class User {

    @MongoId
    private String userId;

    @Indexed(unique = true)
    private String username;

    private Money startingCash;
    private Money currentCash;

    @Builder.Default
    private Money realizedPnl = Money.ZERO;

    public void debit(Money amount) {
        currentCash = currentCash.subtract(amount);
    }

    public void credit(Money amount) {
        currentCash = currentCash.add(amount);
    }

    /**
     * Detached copy for snapshots and persistence calls.
     */
    public User copy() {
        return toBuilder().build();
    }
}
