package com.prediction.market.options_market.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.engine.PricingEngine;
import com.prediction.market.options_market.engine.SimulationMode;
import com.prediction.market.options_market.engine.SimulationSettings;
import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.PricePoint;
import com.prediction.market.options_market.entity.TradeResult;
import com.prediction.market.options_market.entity.TradeSide;
import com.prediction.market.options_market.persistence.InMemoryLedgerStore;
import com.prediction.market.options_market.service.LedgerSettings;
import com.prediction.market.options_market.service.PortfolioLedger;

import io.github.resilience4j.retry.Retry;

@ExtendWith(MockitoExtension.class)
class PortfolioIntegratorTest {

  @Mock
  private PortfolioLedger mockLedger;

  private MarketSimulationEngine engine;

  @BeforeEach
  void setUp() {
    SimulationSettings settings = SimulationSettings.builder().totalPoints(50).forcedOutcome(true).build();
    engine = new MarketSimulationEngine(settings, new Random(21L), Clock.systemUTC(), null);
  }

  @AfterEach
  void tearDown() {
    engine.stop();
  }

  @Test
  void forwardsEveryPointAndCountsUpdates() {
    PortfolioIntegrator integrator = new PortfolioIntegrator(engine, mockLedger);

    assertThat(integrator.attach()).isTrue();
    assertThat(integrator.attach()).isFalse();
    verify(mockLedger).setPricingHorizon(50);

    for (int i = 0; i < 30; i++) {
      engine.step();
    }

    verify(mockLedger, times(30)).updateMarket(any(PricePoint.class));
    PortfolioIntegrator.IntegrationStats stats = integrator.getStats();
    assertThat(stats.getUpdateCount()).isEqualTo(30);
    assertThat(stats.getCurrentMarketPrice()).isEqualTo(engine.getCurrentPrice());
    assertThat(stats.isAttached()).isTrue();
  }

  @Test
  void detachStopsForwarding() {
    PortfolioIntegrator integrator = new PortfolioIntegrator(engine, mockLedger);
    integrator.attach();
    assertThat(integrator.detach()).isTrue();
    assertThat(integrator.detach()).isFalse();

    engine.step();

    verify(mockLedger, never()).updateMarket(any(PricePoint.class));
  }

  @Test
  void resolvesAtTheEnginePrice() {
    when(mockLedger.resolveMarket(anyDouble())).thenReturn(true);
    PortfolioIntegrator integrator = new PortfolioIntegrator(engine, mockLedger);
    engine.step();

    assertThat(integrator.resolveAtCurrentPrice()).isTrue();

    verify(mockLedger).resolveMarket(engine.getCurrentPrice());
  }

  @Test
  void liveRunDrivesTradableQuotesThroughSettlement() throws Exception {
    PortfolioLedger ledger = new PortfolioLedger(new InMemoryLedgerStore(), new PricingEngine(),
        LedgerSettings.defaults(), Retry.ofDefaults("integration"), Clock.systemUTC());
    PortfolioIntegrator integrator = new PortfolioIntegrator(engine, ledger);
    integrator.attach();
    String trader = ledger.createUser("trader", Money.of(15_000L));

    engine.start(Duration.ZERO, SimulationMode.MANUAL);
    engine.step();
    TradeResult buy = ledger.executeTrade(trader, 0.3, 5, TradeSide.BUY);
    for (int i = 0; i < 49; i++) {
      engine.step();
    }
    engine.step();

    assertThat(buy.isSuccess()).isTrue();
    assertThat(ledger.getPricingHorizon()).isEqualTo(50);
    assertThat(ledger.getQuotes().orElseThrow().getSequenceIndex()).isEqualTo(49);
    assertThat(integrator.resolveAtCurrentPrice()).isTrue();
    assertThat(ledger.getFinalPrice()).contains(engine.getCurrentPrice());
    assertThat(ledger.getPortfolio(trader).orElseThrow().getPositions().get(0).getSettlementValue().isNegative())
        .isFalse();
  }
}
