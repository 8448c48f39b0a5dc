package com.prediction.market.options_market.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.prediction.market.options_market.cache.PositionStore;
import com.prediction.market.options_market.cache.QuoteStore;
import com.prediction.market.options_market.engine.PricingEngine;
import com.prediction.market.options_market.entity.MarketSummary;
import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.OptionQuote;
import com.prediction.market.options_market.entity.Portfolio;
import com.prediction.market.options_market.entity.Position;
import com.prediction.market.options_market.entity.PositionStatus;
import com.prediction.market.options_market.entity.PositionSummary;
import com.prediction.market.options_market.entity.PricePoint;
import com.prediction.market.options_market.entity.ProbabilitySnapshot;
import com.prediction.market.options_market.entity.QuoteSet;
import com.prediction.market.options_market.entity.QuoteSide;
import com.prediction.market.options_market.entity.Trade;
import com.prediction.market.options_market.entity.TradeResult;
import com.prediction.market.options_market.entity.TradeSide;
import com.prediction.market.options_market.entity.User;
import com.prediction.market.options_market.persistence.LedgerPersistenceException;
import com.prediction.market.options_market.persistence.LedgerStore;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Users, trades, positions and settlement for one market.
 *
 * Trade flow:
 * 1. Validate request (user, market open, quantity)
 * 2. Read one quote set snapshot and price the strike (ask for BUY, bid for SELL)
 * 3. Check position limit and cash (BUY) or owned contracts (SELL)
 * 4. Apply cash and position change in memory
 * 5. Append trade and write cash through the store
 * 6. On store failure undo step 4 and delete the stored trade
 *
 * Each user's book is mutated under that user's lock. Trades hold the market
 * read lock and resolution holds the write lock, so no trade interleaves with
 * settlement.
 */
@Slf4j
public class PortfolioLedger {

    private final LedgerStore store;
    private final PricingEngine pricingEngine;
    private final LedgerSettings settings;
    private final Retry retry;
    private final Clock clock;
    private final TradeValidator tradeValidator = new TradeValidator();
    private final PositionStore positionStore = new PositionStore();
    private final QuoteStore quoteStore = new QuoteStore();

    private final ReentrantReadWriteLock marketLock = new ReentrantReadWriteLock();
    private final ReentrantLock userCreationLock = new ReentrantLock();

    private volatile long pricingHorizon = 1;
    private volatile boolean resolved;
    private volatile Double finalPrice;

    public PortfolioLedger(LedgerStore store, PricingEngine pricingEngine, LedgerSettings settings, Retry retry,
            Clock clock) {
        settings.validate();
        this.store = store;
        this.pricingEngine = pricingEngine;
        this.settings = settings;
        this.retry = retry;
        this.clock = clock;
    }

    // ---- users ----

    public String createUser(String username) {
        return createUser(username, settings.getDefaultStartingCash());
    }

    /**
     * Creates an account, or returns the id of the existing one with this
     * username (loading it from the store if it is not in memory yet).
     *
     * @throws LedgerPersistenceException if the store cannot be reached
     */
    public String createUser(String username, Money startingCash) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (startingCash == null || startingCash.isNegative()) {
            throw new IllegalArgumentException("Starting cash must be >= 0: " + startingCash);
        }

        userCreationLock.lock();
        try {
            Optional<User> cached = positionStore.findByUsername(username);
            if (cached.isPresent()) {
                log.info("User already exists, returning existing account: username={}", username);
                return cached.get().getUserId();
            }

            Optional<User> stored = retry.executeSupplier(() -> store.findUserByUsername(username));
            if (stored.isPresent()) {
                log.info("User found in store, loading existing account: username={}", username);
                loadUser(stored.get());
                return stored.get().getUserId();
            }

            User user = User.builder()
                    .userId(UUID.randomUUID().toString())
                    .username(username)
                    .startingCash(startingCash)
                    .currentCash(startingCash)
                    .realizedPnl(Money.ZERO)
                    .build();
            retry.executeRunnable(() -> store.upsertUser(user));
            positionStore.putUser(user);

            log.info("Created user: userId={}, username={}, startingCash={}", user.getUserId(), username,
                    startingCash);
            return user.getUserId();
        } finally {
            userCreationLock.unlock();
        }
    }

    /**
     * Rebuilds every stored account by replaying its trades. A recorded
     * resolution is restored first so replayed positions come back settled.
     *
     * @return number of users loaded
     * @throws LedgerStateException if a trade log cannot be replayed
     */
    public int restoreFromStore() {
        marketLock.writeLock().lock();
        userCreationLock.lock();
        try {
            if (!resolved) {
                retry.executeSupplier(store::findResolution).ifPresent(price -> {
                    resolved = true;
                    finalPrice = price;
                    log.info("Restored market resolution at final price {}", String.format("%.2f", price));
                });
            }

            List<User> users = retry.executeSupplier(store::findAllUsers);
            int loaded = 0;
            for (User user : users) {
                if (positionStore.getUser(user.getUserId()).isPresent()) {
                    log.debug("User already in memory, skipping restore: userId={}", user.getUserId());
                    continue;
                }
                loadUser(user);
                loaded++;
            }
            log.info("Restored {} users from ledger store", loaded);
            return loaded;
        } finally {
            userCreationLock.unlock();
            marketLock.writeLock().unlock();
        }
    }

    private void loadUser(User stored) {
        User user = stored.copy();
        if (user.getRealizedPnl() == null) {
            user.setRealizedPnl(Money.ZERO);
        }
        List<Trade> trades = retry.executeSupplier(() -> store.findTradesByUser(user.getUserId()));

        Money expectedCash = user.getStartingCash();
        for (Trade trade : trades) {
            double strike = canonicalStrike(trade.getStrike())
                    .orElseThrow(() -> new LedgerStateException(String.format(
                            "Trade %s references unknown strike %s", trade.getId(), trade.getStrike())));
            Position position = positionStore.getOrCreatePosition(user.getUserId(), strike);
            position.addTrade(trade);
            if (position.getNetQuantity() < 0) {
                throw new LedgerStateException(String.format(
                        "Trade %s leaves user %s short %d contracts at strike %s",
                        trade.getId(), user.getUserId(), -position.getNetQuantity(), strike));
            }
            expectedCash = expectedCash.subtract(trade.getSignedTotalCost());
        }

        Money expectedRealized = Money.ZERO;
        if (resolved) {
            for (Position position : positionStore.getPositions(user.getUserId())) {
                if (position.getStatus() == PositionStatus.OPEN && !position.isFlat()) {
                    expectedCash = expectedCash.add(position.settle(finalPrice));
                }
            }
            expectedRealized = expectedCash.subtract(user.getStartingCash());
        }

        if (!expectedCash.equals(user.getCurrentCash()) || !expectedRealized.equals(user.getRealizedPnl())) {
            log.warn("Cash drift detected: userId={}, stored={}/{}, fromLedger={}/{} (cash/realized)",
                    user.getUserId(), user.getCurrentCash(), user.getRealizedPnl(), expectedCash, expectedRealized);
            user.setCurrentCash(expectedCash);
            user.setRealizedPnl(expectedRealized);
            try {
                retry.executeRunnable(
                        () -> store.updateUserCash(user.getUserId(), user.getCurrentCash(), user.getRealizedPnl()));
            } catch (LedgerPersistenceException e) {
                log.error("Failed to write reconciled cash: userId={}", user.getUserId(), e);
            }
        }
        positionStore.putUser(user);
        log.debug("Loaded user: userId={}, trades={}, positions={}", user.getUserId(), trades.size(),
                positionStore.getPositions(user.getUserId()).size());
    }

    // ---- market data ----

    /**
     * Reprices every configured strike from this point and publishes the new set.
     */
    public void updateMarket(PricePoint point) {
        ProbabilitySnapshot snapshot = ProbabilitySnapshot.fromPrice(point.getPrice());
        List<OptionQuote> quotes = pricingEngine.quoteAll(snapshot, settings.getStrikes(), settings.getDecayRate(),
                point.getSequenceIndex(), pricingHorizon);
        quoteStore.replace(new QuoteSet(point.getSequenceIndex(), point.getPrice(), quotes));
        if (log.isDebugEnabled()) {
            log.debug("Updated market data: index={}, price={}, quotes={}", point.getSequenceIndex(),
                    String.format("%.2f", point.getPrice()), quotes.size());
        }
    }

    /**
     * Number of samples the decay runs over; 1 disables decay.
     */
    public void setPricingHorizon(long totalPoints) {
        if (totalPoints < 1) {
            throw new IllegalArgumentException("Pricing horizon must be >= 1: " + totalPoints);
        }
        this.pricingHorizon = totalPoints;
    }

    public long getPricingHorizon() {
        return pricingHorizon;
    }

    public Optional<QuoteSet> getQuotes() {
        return quoteStore.getCurrent();
    }

    /**
     * @throws MarketDataUnavailableException before the first market update
     * @throws IllegalArgumentException       for a strike that is not quoted
     */
    public double getOptionPrice(double strike, QuoteSide side) {
        QuoteSet quoteSet = quoteStore.getCurrent()
                .orElseThrow(() -> new MarketDataUnavailableException("No market data available"));
        OptionQuote quote = quoteSet.find(strike)
                .orElseThrow(() -> new IllegalArgumentException("Strike price " + strike + " not available"));
        return resolvePrice(quoteSet, quote, side);
    }

    private double resolvePrice(QuoteSet quoteSet, OptionQuote quote, QuoteSide side) {
        double price = quote.get(side);
        if (Double.isFinite(price)) {
            return price;
        }
        double fallback = pricingEngine.fallbackPrice(quoteSet.getUnderlyingPrice(), quote.getStrike());
        log.warn("{} price for strike {} is not finite ({}), using fallback price {}", side, quote.getStrike(),
                price, fallback);
        return fallback;
    }

    /**
     * @throws IllegalArgumentException       for an unknown user or unquoted strike
     * @throws MarketDataUnavailableException before the first market update
     */
    public int positionLimit(String userId, double strike) {
        User user = positionStore.getUser(userId)
                .orElseThrow(() -> new IllegalArgumentException("User not found: " + userId));
        double ask = getOptionPrice(strike, QuoteSide.ASK);
        return positionStore.withUserLock(userId, () -> tradeValidator.positionLimit(user.getCurrentCash(), ask,
                settings.getMaxPositionFraction(), settings.getMinLiquidity()));
    }

    public MarketSummary getMarketSummary() {
        Optional<QuoteSet> quoteSet = quoteStore.getCurrent();
        return MarketSummary.builder()
                .currentPrice(quoteSet.map(QuoteSet::getUnderlyingPrice).orElse(null))
                .resolved(resolved)
                .finalPrice(finalPrice)
                .quotes(quoteSet.map(QuoteSet::getQuotes).orElse(List.of()))
                .build();
    }

    // ---- trading ----

    /**
     * Executes a market trade at the current quote. Business-rule failures
     * come back as a rejected result; this method does not throw for them.
     */
    public TradeResult executeTrade(String userId, double strike, int quantity, TradeSide side) {
        marketLock.readLock().lock();
        try {
            Optional<User> user = userId == null ? Optional.empty() : positionStore.getUser(userId);
            if (user.isEmpty()) {
                return reject(userId, "User not found");
            }
            return positionStore.withUserLock(userId, () -> executeLocked(user.get(), strike, quantity, side));
        } finally {
            marketLock.readLock().unlock();
        }
    }

    private TradeResult executeLocked(User user, double strike, int quantity, TradeSide side) {
        String userId = user.getUserId();

        TradeValidator.ValidationResult validation = tradeValidator.validateRequest(resolved, quantity, side);
        if (!validation.isValid()) {
            return reject(userId, validation.getErrorMessage());
        }

        Optional<QuoteSet> current = quoteStore.getCurrent();
        if (current.isEmpty()) {
            return reject(userId, "No market data available for trading");
        }
        QuoteSet quoteSet = current.get();
        Optional<OptionQuote> quote = quoteSet.find(strike);
        if (quote.isEmpty()) {
            return reject(userId, "Strike price " + strike + " not available");
        }
        double canonicalStrike = quote.get().getStrike();

        double price = resolvePrice(quoteSet, quote.get(), side == TradeSide.BUY ? QuoteSide.ASK : QuoteSide.BID);
        validation = tradeValidator.validatePrice(price);
        if (!validation.isValid()) {
            return reject(userId, validation.getErrorMessage());
        }

        int currentNet = positionStore.getPosition(userId, canonicalStrike)
                .map(Position::getNetQuantity)
                .orElse(0);
        Money cost = Money.ofContracts(price, quantity);

        if (side == TradeSide.BUY) {
            int limit = tradeValidator.positionLimit(user.getCurrentCash(), price,
                    settings.getMaxPositionFraction(), settings.getMinLiquidity());
            validation = tradeValidator.validateBuy(currentNet, quantity, limit, cost, user.getCurrentCash());
        } else {
            validation = tradeValidator.validateSell(currentNet, quantity);
        }
        if (!validation.isValid()) {
            return reject(userId, validation.getErrorMessage());
        }

        Money signedCost = side == TradeSide.BUY ? cost : cost.negate();
        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .timestamp(clock.instant())
                .side(side)
                .strike(canonicalStrike)
                .quantity(quantity)
                .pricePerContract(price)
                .signedTotalCost(signedCost)
                .underlyingPriceAtTrade(quoteSet.getUnderlyingPrice())
                .build();

        Position position = positionStore.getOrCreatePosition(userId, canonicalStrike);
        user.debit(signedCost);
        position.addTrade(trade);

        try {
            retry.executeRunnable(() -> store.appendTrade(trade));
            retry.executeRunnable(() -> store.updateUserCash(userId, user.getCurrentCash(), user.getRealizedPnl()));
        } catch (LedgerPersistenceException e) {
            position.removeTrade(trade);
            user.credit(signedCost);
            compensate(trade);
            log.error("Trade rolled back after persistence failure: tradeId={}, userId={}", trade.getId(), userId,
                    e);
            return TradeResult.rejected("Persistence error: " + e.getMessage());
        }

        log.info("Trade executed: tradeId={}, userId={}, side={}, strike={}, qty={}, price={}, total={}",
                trade.getId(), userId, side, canonicalStrike, quantity, price, cost);
        return TradeResult.executed(trade);
    }

    private void compensate(Trade trade) {
        try {
            store.deleteTrade(trade.getId());
        } catch (LedgerPersistenceException e) {
            log.error("Compensating delete failed, stored trade may be orphaned: tradeId={}", trade.getId(), e);
        }
    }

    private TradeResult reject(String userId, String reason) {
        log.warn("Trade rejected: {} (userId={})", reason, userId);
        return TradeResult.rejected(reason);
    }

    // ---- queries ----

    public Optional<Portfolio> getPortfolio(String userId) {
        Optional<User> user = userId == null ? Optional.empty() : positionStore.getUser(userId);
        if (user.isEmpty()) {
            return Optional.empty();
        }
        Optional<QuoteSet> quoteSet = quoteStore.getCurrent();
        return Optional.of(positionStore.withUserLock(userId, () -> buildPortfolio(user.get(), quoteSet)));
    }

    private Portfolio buildPortfolio(User user, Optional<QuoteSet> quoteSet) {
        Portfolio.PortfolioBuilder portfolio = Portfolio.builder()
                .userId(user.getUserId())
                .username(user.getUsername())
                .startingCash(user.getStartingCash())
                .cash(user.getCurrentCash());

        Money totalValue = Money.ZERO;
        Money totalUnrealized = Money.ZERO;
        for (Position position : positionStore.getPositions(user.getUserId())) {
            if (position.isFlat()) {
                continue;
            }
            PositionSummary.PositionSummaryBuilder summary = PositionSummary.builder()
                    .strike(position.getStrike())
                    .quantity(position.getNetQuantity())
                    .averageCost(position.getAverageCostPerContract())
                    .costBasis(position.getCostBasis())
                    .status(position.getStatus())
                    .settlementValue(position.getSettlementValue());

            if (position.getStatus() == PositionStatus.SETTLED) {
                summary.currentPrice(0.0).positionValue(Money.ZERO).unrealizedPnl(Money.ZERO);
            } else {
                double mid = markPrice(position, quoteSet);
                Money value = Money.ofContracts(mid, position.getNetQuantity());
                Money unrealized = position.unrealizedPnl(mid);
                summary.currentPrice(mid).positionValue(value).unrealizedPnl(unrealized);
                totalValue = totalValue.add(value);
                totalUnrealized = totalUnrealized.add(unrealized);
            }
            portfolio.position(summary.build());
        }

        return portfolio
                .totalPositionValue(totalValue)
                .totalPortfolioValue(user.getCurrentCash().add(totalValue))
                .totalUnrealizedPnl(totalUnrealized)
                .totalRealizedPnl(user.getRealizedPnl())
                .totalPnl(user.getRealizedPnl().add(totalUnrealized))
                .build();
    }

    /**
     * Mid quote, or the average cost while no quote set exists (restored book
     * before the first price).
     */
    private double markPrice(Position position, Optional<QuoteSet> quoteSet) {
        if (quoteSet.isEmpty()) {
            return position.getAverageCostPerContract().toDouble();
        }
        Optional<OptionQuote> quote = quoteSet.get().find(position.getStrike());
        if (quote.isEmpty()) {
            return position.getAverageCostPerContract().toDouble();
        }
        return resolvePrice(quoteSet.get(), quote.get(), QuoteSide.MID);
    }

    /**
     * @return the user's trades, oldest first; empty for an unknown user
     */
    public List<Trade> getTrades(String userId) {
        if (userId == null || positionStore.getUser(userId).isEmpty()) {
            return List.of();
        }
        return positionStore.withUserLock(userId, () -> {
            List<Trade> trades = new ArrayList<>();
            for (Position position : positionStore.getPositions(userId)) {
                trades.addAll(position.getTrades());
            }
            trades.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
            return List.copyOf(trades);
        });
    }

    public Optional<User> getUser(String userId) {
        return positionStore.getUser(userId).map(User::copy);
    }

    // ---- settlement ----

    /**
     * Settles every open position at the final underlying price. Happens once;
     * later calls return false and change nothing.
     *
     * @param finalPrice underlying on the 0-100 scale
     */
    public boolean resolveMarket(double finalPrice) {
        if (!Double.isFinite(finalPrice) || finalPrice < 0 || finalPrice > 100) {
            throw new IllegalArgumentException("Final price must be in [0,100]: " + finalPrice);
        }

        marketLock.writeLock().lock();
        try {
            if (resolved) {
                log.warn("Market already resolved at {}, ignoring resolve at {}", this.finalPrice, finalPrice);
                return false;
            }
            resolved = true;
            this.finalPrice = finalPrice;
            log.info("Market resolving at final price: {}", String.format("%.2f", finalPrice));
            try {
                retry.executeRunnable(() -> store.saveResolution(finalPrice, clock.instant()));
            } catch (LedgerPersistenceException e) {
                log.error("Failed to persist market resolution at {}", finalPrice, e);
            }

            for (User user : positionStore.getUsers()) {
                positionStore.withUserLock(user.getUserId(), () -> {
                    settleUser(user, finalPrice);
                    return null;
                });
            }
            log.info("All positions settled: users={}", positionStore.getUsers().size());
            return true;
        } finally {
            marketLock.writeLock().unlock();
        }
    }

    private void settleUser(User user, double finalPrice) {
        Money totalSettlement = Money.ZERO;
        for (Position position : positionStore.getPositions(user.getUserId())) {
            if (position.getStatus() != PositionStatus.OPEN || position.isFlat()) {
                continue;
            }
            Money settlement = position.settle(finalPrice);
            user.credit(settlement);
            totalSettlement = totalSettlement.add(settlement);
            log.info("Position settled: username={}, strike={}, qty={}, value={}", user.getUsername(),
                    position.getStrike(), position.getNetQuantity(), settlement);
        }
        user.setRealizedPnl(user.getCurrentCash().subtract(user.getStartingCash()));

        try {
            retry.executeRunnable(
                    () -> store.updateUserCash(user.getUserId(), user.getCurrentCash(), user.getRealizedPnl()));
        } catch (LedgerPersistenceException e) {
            log.error("Failed to persist settlement: userId={}, settlement={}", user.getUserId(), totalSettlement, e);
        }
    }

    public boolean isResolved() {
        return resolved;
    }

    public Optional<Double> getFinalPrice() {
        return Optional.ofNullable(finalPrice);
    }

    private Optional<Double> canonicalStrike(double strike) {
        for (Double configured : settings.getStrikes()) {
            if (Math.abs(configured - strike) < 1e-9) {
                return Optional.of(configured);
            }
        }
        return Optional.empty();
    }
}
