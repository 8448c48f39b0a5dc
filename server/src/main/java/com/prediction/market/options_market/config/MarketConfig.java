package com.prediction.market.options_market.config;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoOperations;

import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.engine.PricingEngine;
import com.prediction.market.options_market.execution.PortfolioIntegrator;
import com.prediction.market.options_market.export.PricePointCsvExporter;
import com.prediction.market.options_market.export.PricePointRecorder;
import com.prediction.market.options_market.persistence.InMemoryLedgerStore;
import com.prediction.market.options_market.persistence.LedgerPersistenceException;
import com.prediction.market.options_market.persistence.LedgerStore;
import com.prediction.market.options_market.persistence.MongoLedgerStore;
import com.prediction.market.options_market.repositories.MarketResolutionRepository;
import com.prediction.market.options_market.repositories.TradeRepository;
import com.prediction.market.options_market.repositories.UserRepository;
import com.prediction.market.options_market.service.PortfolioLedger;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class MarketConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    PricingEngine pricingEngine() {
        return new PricingEngine();
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.ledger", name = "store", havingValue = "mongo")
    public LedgerStore mongoLedgerStore(UserRepository userRepository, TradeRepository tradeRepository,
            MarketResolutionRepository resolutionRepository, MongoOperations mongoOperations) {
        log.info("Ledger store: MongoDB");
        return new MongoLedgerStore(userRepository, tradeRepository, resolutionRepository, mongoOperations);
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.ledger", name = "store", havingValue = "memory", matchIfMissing = true)
    public LedgerStore inMemoryLedgerStore() {
        log.info("Ledger store: in-memory");
        return new InMemoryLedgerStore();
    }

    @Bean
    public Retry ledgerStoreRetry(MarketProperties properties) {
        MarketProperties.Persistence persistence = properties.getPersistence();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(persistence.getMaxAttempts())
            .waitDuration(persistence.getRetryWait())
            .retryExceptions(LedgerPersistenceException.class)
            .build();
        Retry retry = Retry.of("ledger-store", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying ledger store call: attempt={}, error={}",
            event.getNumberOfRetryAttempts(), String.valueOf(event.getLastThrowable())));
        return retry;
    }

    @Bean
    public PortfolioLedger portfolioLedger(LedgerStore ledgerStore, PricingEngine pricingEngine,
            MarketProperties properties, Retry ledgerStoreRetry, Clock clock) {
        return new PortfolioLedger(ledgerStore, pricingEngine, properties.getLedger().toSettings(),
            ledgerStoreRetry, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.export", name = "enabled", havingValue = "true")
    public PricePointRecorder pricePointRecorder(MarketProperties properties, Clock clock) {
        MarketProperties.Export export = properties.getExport();
        return new PricePointCsvExporter(Path.of(export.getDirectory()), export.getFileName(), clock);
    }

    @Bean
    public MarketSimulationEngine marketSimulationEngine(MarketProperties properties, Clock clock,
            ObjectProvider<PricePointRecorder> recorder) {
        return new MarketSimulationEngine(properties.getSimulation().toSettings(), new Random(), clock,
            recorder.getIfAvailable());
    }

    @Bean
    public PortfolioIntegrator portfolioIntegrator(MarketSimulationEngine engine, PortfolioLedger ledger) {
        PortfolioIntegrator integrator = new PortfolioIntegrator(engine, ledger);
        integrator.attach();
        return integrator;
    }
}
