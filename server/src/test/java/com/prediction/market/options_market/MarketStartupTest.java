package com.prediction.market.options_market;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.prediction.market.options_market.config.MarketProperties;
import com.prediction.market.options_market.engine.MarketSimulationEngine;
import com.prediction.market.options_market.engine.SimulationMode;
import com.prediction.market.options_market.engine.SimulationState;
import com.prediction.market.options_market.persistence.LedgerPersistenceException;
import com.prediction.market.options_market.service.PortfolioLedger;

@ExtendWith(MockitoExtension.class)
class MarketStartupTest {

  @Mock
  private PortfolioLedger ledger;

  @Mock
  private MarketSimulationEngine engine;

  private final MarketProperties properties = new MarketProperties();

  @Test
  void restoresLedgerOnStartup() {
    new MarketStartup(ledger, engine, properties).restoreLedger();

    verify(ledger).restoreFromStore();
  }

  @Test
  void skipsRestoreWhenDisabled() {
    properties.getLedger().setRestoreOnStartup(false);

    new MarketStartup(ledger, engine, properties).restoreLedger();

    verify(ledger, never()).restoreFromStore();
  }

  @Test
  void unreachableStoreFailsStartup() {
    when(ledger.restoreFromStore()).thenThrow(new LedgerPersistenceException("no route"));

    assertThatThrownBy(() -> new MarketStartup(ledger, engine, properties).restoreLedger())
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(LedgerPersistenceException.class);
  }

  @Test
  void startsRunOnlyWhenAutoStartIsSet() {
    MarketStartup startup = new MarketStartup(ledger, engine, properties);
    startup.startSimulation();
    verify(engine, never()).start(any(Duration.class), any(SimulationMode.class));

    properties.getSimulation().setAutoStart(true);
    properties.getSimulation().setInterval(Duration.ofMillis(100));
    startup.startSimulation();

    verify(engine).start(Duration.ofMillis(100), SimulationMode.AUTO);
  }

  @Test
  void stopsActiveRunOnShutdown() {
    when(engine.getState()).thenReturn(SimulationState.RUNNING);

    new MarketStartup(ledger, engine, properties).stopSimulation();

    verify(engine).stop();
  }
}
