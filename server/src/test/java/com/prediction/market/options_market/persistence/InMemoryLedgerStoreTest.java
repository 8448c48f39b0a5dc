package com.prediction.market.options_market.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.Trade;
import com.prediction.market.options_market.entity.TradeSide;
import com.prediction.market.options_market.entity.User;

class InMemoryLedgerStoreTest {

  private final InMemoryLedgerStore store = new InMemoryLedgerStore();

  private static User user(String id, String name) {
    return User.builder()
        .userId(id)
        .username(name)
        .startingCash(Money.of(100L))
        .currentCash(Money.of(100L))
        .build();
  }

  private static Trade trade(String id, String userId, Instant at) {
    return Trade.builder()
        .id(id)
        .userId(userId)
        .timestamp(at)
        .side(TradeSide.BUY)
        .strike(0.5)
        .quantity(1)
        .pricePerContract(0.4)
        .signedTotalCost(Money.of("0.40"))
        .underlyingPriceAtTrade(80.0)
        .build();
  }

  @Test
  void storesDetachedUserCopies() {
    User alice = user("u1", "alice");
    store.upsertUser(alice);
    alice.debit(Money.of(50L));

    User loaded = store.findUserByUsername("alice").orElseThrow();

    assertThat(loaded.getCurrentCash()).isEqualTo(Money.of(100L));
    assertThat(loaded.getRealizedPnl()).isEqualTo(Money.ZERO);
    assertThat(store.findUserByUsername("bob")).isEmpty();
    assertThat(store.findAllUsers()).hasSize(1);
  }

  @Test
  void updatesCashOfKnownUsersOnly() {
    store.upsertUser(user("u1", "alice"));

    store.updateUserCash("u1", Money.of(70L), Money.of(-30L));

    User loaded = store.findAllUsers().get(0);
    assertThat(loaded.getCurrentCash()).isEqualTo(Money.of(70L));
    assertThat(loaded.getRealizedPnl()).isEqualTo(Money.of(-30L));
    assertThatThrownBy(() -> store.updateUserCash("u2", Money.ZERO, Money.ZERO))
        .isInstanceOf(LedgerPersistenceException.class);
  }

  @Test
  void returnsTradesOldestFirstAndHonoursDeletes() {
    Instant t0 = Instant.parse("2025-01-01T00:00:00Z");
    store.appendTrade(trade("b", "u1", t0.plusSeconds(10)));
    store.appendTrade(trade("a", "u1", t0));
    store.appendTrade(trade("c", "u1", t0.plusSeconds(10)));
    store.appendTrade(trade("x", "u2", t0));

    assertThat(store.findTradesByUser("u1")).extracting(Trade::getId).containsExactly("a", "b", "c");

    store.deleteTrade("b");
    store.deleteTrade("missing");

    assertThat(store.findTradesByUser("u1")).extracting(Trade::getId).containsExactly("a", "c");
    assertThatThrownBy(() -> store.appendTrade(trade("a", "u1", t0))).isInstanceOf(LedgerPersistenceException.class);
  }
}
