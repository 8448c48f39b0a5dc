package com.prediction.market.options_market.execution;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.engine.PriceSink;
import com.prediction.market.options_market.entity.PricePoint;
import com.prediction.market.options_market.service.PortfolioLedger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Feeds simulated prices into the ledger so quotes follow the live path.
 */
@Slf4j
public class PortfolioIntegrator implements PriceSink {

    private static final long LOG_EVERY_UPDATES = 25;

    private final MarketSimulationEngine engine;
    private final PortfolioLedger ledger;
    private final AtomicLong updates = new AtomicLong();
    private final AtomicBoolean attached = new AtomicBoolean();

    public PortfolioIntegrator(MarketSimulationEngine engine, PortfolioLedger ledger) {
        this.engine = engine;
        this.ledger = ledger;
    }

    @Value
    @Builder
    public static class IntegrationStats {
        long updateCount;
        double currentMarketPrice;
        boolean attached;
    }

    /**
     * Subscribes to the engine and aligns the ledger's decay horizon with the run length.
     *
     * @return false if already attached
     */
    public boolean attach() {
        if (!attached.compareAndSet(false, true)) {
            return false;
        }
        ledger.setPricingHorizon(engine.getTotalPoints());
        engine.subscribe(this);
        log.info("Portfolio integrator attached: totalPoints={}", engine.getTotalPoints());
        return true;
    }

    public boolean detach() {
        if (!attached.compareAndSet(true, false)) {
            return false;
        }
        engine.unsubscribe(this);
        log.info("Portfolio integrator detached after {} updates", updates.get());
        return true;
    }

    @Override
    public void onPrice(PricePoint point) {
        ledger.updateMarket(point);
        long count = updates.incrementAndGet();
        if (count % LOG_EVERY_UPDATES == 0) {
            log.info("Portfolio market data updated: updates={}, price={}", count,
                String.format("%.2f", point.getPrice()));
        }
    }

    /**
     * Settles the ledger at the engine's current price, which after a finished
     * run includes the terminal adjustment.
     *
     * @return false if the market was already resolved
     */
    public boolean resolveAtCurrentPrice() {
        double price = engine.getCurrentPrice();
        log.info("Resolving market from simulation: price={}, outcome={}", String.format("%.2f", price),
            engine.getResolvedOutcome() ? "YES" : "NO");
        return ledger.resolveMarket(price);
    }

    public IntegrationStats getStats() {
        return IntegrationStats.builder()
            .updateCount(updates.get())
            .currentMarketPrice(engine.getCurrentPrice())
            .attached(attached.get())
            .build();
    }
}
