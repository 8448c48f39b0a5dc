package com.prediction.market.options_market;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.prediction.market.options_market.config.MarketProperties;
import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.persistence.LedgerPersistenceException;
import com.prediction.market.options_market.service.PortfolioLedger;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Restores the ledger before anything trades, and optionally starts the run
 * once the context is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketStartup {

    private final PortfolioLedger ledger;
    private final MarketSimulationEngine engine;
    private final MarketProperties properties;

    @PostConstruct
    public void restoreLedger() {
        if (!properties.getLedger().isRestoreOnStartup()) {
            log.info("Ledger restore disabled");
            return;
        }
        try {
            int users = ledger.restoreFromStore();
            log.info("Ledger store reachable, {} users restored", users);
        } catch (LedgerPersistenceException e) {
            throw new IllegalStateException("Ledger store unavailable at startup", e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startSimulation() {
        MarketProperties.Simulation simulation = properties.getSimulation();
        if (!simulation.isAutoStart()) {
            return;
        }
        boolean started = engine.start(simulation.getInterval(), simulation.getMode());
        log.info("Simulation start requested: mode={}, interval={}, started={}", simulation.getMode(),
            simulation.getInterval(), started);
    }

    @PreDestroy
    public void stopSimulation() {
        if (engine.getState().isActive()) {
            engine.stop();
        }
    }
}
