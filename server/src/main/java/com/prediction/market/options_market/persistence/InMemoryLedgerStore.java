package com.prediction.market.options_market.persistence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.Trade;
import com.prediction.market.options_market.entity.User;

/**
 * Process-local store for demos and tests. Holds detached copies of users;
 * trades keep insertion order, which breaks timestamp ties.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, User> users = new ConcurrentHashMap<>();
    private final Map<String, Trade> trades = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile Double resolution;

    @Override
    public void upsertUser(User user) {
        users.put(user.getUserId(), user.copy());
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        return users.values().stream()
                .filter(u -> u.getUsername().equals(username))
                .findFirst()
                .map(User::copy);
    }

    @Override
    public List<User> findAllUsers() {
        return users.values().stream().map(User::copy).collect(Collectors.toList());
    }

    @Override
    public void appendTrade(Trade trade) {
        if (trades.putIfAbsent(trade.getId(), trade) != null) {
            throw new LedgerPersistenceException("Duplicate trade id: " + trade.getId());
        }
    }

    @Override
    public void deleteTrade(String tradeId) {
        trades.remove(tradeId);
    }

    @Override
    public List<Trade> findTradesByUser(String userId) {
        List<Trade> result = new ArrayList<>();
        synchronized (trades) {
            for (Trade trade : trades.values()) {
                if (trade.getUserId().equals(userId)) {
                    result.add(trade);
                }
            }
        }
        result.sort(Comparator.comparing(Trade::getTimestamp));
        return result;
    }

    @Override
    public void updateUserCash(String userId, Money currentCash, Money realizedPnl) {
        User user = users.get(userId);
        if (user == null) {
            throw new LedgerPersistenceException("User not found in store: " + userId);
        }
        user.setCurrentCash(currentCash);
        user.setRealizedPnl(realizedPnl);
    }

    @Override
    public void saveResolution(double finalPrice, Instant resolvedAt) {
        resolution = finalPrice;
    }

    @Override
    public Optional<Double> findResolution() {
        return Optional.ofNullable(resolution);
    }
}
