package com.prediction.market.options_market.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.Trade;
import com.prediction.market.options_market.entity.User;

/**
 * Durable home of users and the trade log.
 *
 * Every method either completes or throws {@link LedgerPersistenceException};
 * none may block indefinitely. The ledger keeps its own in-memory state and
 * uses the store to make each change durable and to rebuild at startup.
 */
public interface LedgerStore {

    void upsertUser(User user);

    Optional<User> findUserByUsername(String username);

    List<User> findAllUsers();

    void appendTrade(Trade trade);

    /**
     * Compensates an {@link #appendTrade} whose surrounding change failed.
     */
    void deleteTrade(String tradeId);

    /**
     * @return the user's trades, oldest first
     */
    List<Trade> findTradesByUser(String userId);

    void updateUserCash(String userId, Money currentCash, Money realizedPnl);

    /**
     * Records the final underlying price. A market resolves once, so a second
     * call overwrites the first.
     */
    void saveResolution(double finalPrice, Instant resolvedAt);

    /**
     * @return the recorded final price, empty while the market is open
     */
    Optional<Double> findResolution();
}
