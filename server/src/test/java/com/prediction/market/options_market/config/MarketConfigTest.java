package com.prediction.market.options_market.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.execution.PortfolioIntegrator;
import com.prediction.market.options_market.export.PricePointCsvExporter;
import com.prediction.market.options_market.export.PricePointRecorder;
import com.prediction.market.options_market.persistence.InMemoryLedgerStore;
import com.prediction.market.options_market.persistence.LedgerStore;
import com.prediction.market.options_market.service.PortfolioLedger;

import io.github.resilience4j.retry.Retry;

class MarketConfigTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void wiresInMemoryMarketByDefault() {
    runner.withPropertyValues("market.simulation.total-points=40", "market.persistence.max-attempts=4")
        .run(context -> {
          assertThat(context).hasSingleBean(PortfolioLedger.class);
          assertThat(context.getBean(LedgerStore.class)).isInstanceOf(InMemoryLedgerStore.class);
          assertThat(context).doesNotHaveBean(PricePointRecorder.class);
          assertThat(context.getBean(Retry.class).getRetryConfig().getMaxAttempts()).isEqualTo(4);
          assertThat(context.getBean(MarketSimulationEngine.class).getTotalPoints()).isEqualTo(40);
          assertThat(context.getBean(PortfolioIntegrator.class).getStats().isAttached()).isTrue();
          assertThat(context.getBean(PortfolioLedger.class).getPricingHorizon()).isEqualTo(40);
        });
  }

  @Test
  void exportBeanFollowsFlag() {
    runner.withPropertyValues("market.export.enabled=true", "market.export.directory=build/test-export")
        .run(context -> assertThat(context.getBean(PricePointRecorder.class))
            .isInstanceOf(PricePointCsvExporter.class));
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(MarketProperties.class)
  @Import(MarketConfig.class)
  static class TestConfig {
  }
}
