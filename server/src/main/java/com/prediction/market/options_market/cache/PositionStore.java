package com.prediction.market.options_market.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.prediction.market.options_market.entity.Position;
import com.prediction.market.options_market.entity.User;

/**
 * Hot-path home of users and their positions.
 *
 * Maps are concurrent, but a user's cash and positions are only mutated while
 * holding that user's lock (see {@link #withUserLock}).
 */
public class PositionStore {
    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> userIdsByUsername = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentHashMap<Double, Position>> positions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public Optional<User> getUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public Optional<User> findByUsername(String username) {
        String userId = userIdsByUsername.get(username);
        return userId == null ? Optional.empty() : getUser(userId);
    }

    public void putUser(User user) {
        users.put(user.getUserId(), user);
        userIdsByUsername.put(user.getUsername(), user.getUserId());
    }

    public Collection<User> getUsers() {
        return users.values();
    }

    /**
     * @param strike canonical strike as configured
     */
    public Position getOrCreatePosition(String userId, double strike) {
        return positions
            .computeIfAbsent(userId, id -> new ConcurrentHashMap<>())
            .computeIfAbsent(strike, s -> new Position(userId, s));
    }

    public Optional<Position> getPosition(String userId, double strike) {
        ConcurrentHashMap<Double, Position> byStrike = positions.get(userId);
        return byStrike == null ? Optional.empty() : Optional.ofNullable(byStrike.get(strike));
    }

    /**
     * @return the user's positions ordered by strike
     */
    public List<Position> getPositions(String userId) {
        ConcurrentHashMap<Double, Position> byStrike = positions.get(userId);
        if (byStrike == null) {
            return List.of();
        }
        List<Position> result = new ArrayList<>(byStrike.values());
        result.sort(Comparator.comparingDouble(Position::getStrike));
        return result;
    }

    public <T> T withUserLock(String userId, Supplier<T> action) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
