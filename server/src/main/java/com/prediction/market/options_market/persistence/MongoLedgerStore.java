package com.prediction.market.options_market.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import com.prediction.market.options_market.entity.MarketResolution;
import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.Trade;
import com.prediction.market.options_market.entity.User;
import com.prediction.market.options_market.repositories.MarketResolutionRepository;
import com.prediction.market.options_market.repositories.TradeRepository;
import com.prediction.market.options_market.repositories.UserRepository;

import com.mongodb.client.result.UpdateResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LedgerStore} on MongoDB collections {@code users}, {@code trades} and
 * {@code market_resolution}.
 * Driver and mapping failures surface as {@link LedgerPersistenceException}.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private final UserRepository userRepository;
    private final TradeRepository tradeRepository;
    private final MarketResolutionRepository resolutionRepository;
    private final MongoOperations mongoOperations;

    @Override
    public void upsertUser(User user) {
        try {
            userRepository.save(user.copy());
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to save user " + user.getUserId(), e);
        }
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        try {
            return userRepository.findByUsername(username);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to look up user " + username, e);
        }
    }

    @Override
    public List<User> findAllUsers() {
        try {
            return userRepository.findAll();
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to load users", e);
        }
    }

    @Override
    public void appendTrade(Trade trade) {
        try {
            tradeRepository.insert(trade);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Ledger append failed for trade " + trade.getId(), e);
        }
    }

    @Override
    public void deleteTrade(String tradeId) {
        try {
            tradeRepository.deleteById(tradeId);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to delete trade " + tradeId, e);
        }
    }

    @Override
    public List<Trade> findTradesByUser(String userId) {
        try {
            return tradeRepository.findByUserIdOrderByTimestampAsc(userId);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to load trades for user " + userId, e);
        }
    }

    /**
     * Matched count, not modified count: rewriting unchanged figures is a
     * successful update.
     */
    @Override
    public void updateUserCash(String userId, Money currentCash, Money realizedPnl) {
        UpdateResult result;
        try {
            result = mongoOperations.updateFirst(
                    Query.query(Criteria.where("_id").is(userId)),
                    new Update().set("currentCash", currentCash).set("realizedPnl", realizedPnl),
                    User.class);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to update cash for user " + userId, e);
        }
        if (result.getMatchedCount() == 0) {
            log.warn("Cash update matched no user document: userId={}", userId);
            throw new LedgerPersistenceException("User not found in store: " + userId);
        }
    }

    @Override
    public void saveResolution(double finalPrice, Instant resolvedAt) {
        try {
            resolutionRepository.save(MarketResolution.of(finalPrice, resolvedAt));
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to save market resolution", e);
        }
    }

    @Override
    public Optional<Double> findResolution() {
        try {
            return resolutionRepository.findById(MarketResolution.MARKET_ID).map(MarketResolution::getFinalPrice);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to load market resolution", e);
        }
    }
}
