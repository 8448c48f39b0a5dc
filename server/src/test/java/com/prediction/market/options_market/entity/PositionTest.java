package com.prediction.market.options_market.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class PositionTest {

  private static Trade trade(TradeSide side, int quantity, double price) {
    Money total = Money.ofContracts(price, quantity);
    return Trade.builder()
        .id(UUID.randomUUID().toString())
        .userId("u1")
        .timestamp(Instant.now())
        .side(side)
        .strike(0.5)
        .quantity(quantity)
        .pricePerContract(price)
        .signedTotalCost(side == TradeSide.BUY ? total : total.negate())
        .underlyingPriceAtTrade(80.0)
        .build();
  }

  @Test
  void quantityAndCostBasisFollowTheTradeList() {
    Position position = new Position("u1", 0.5);
    position.addTrade(trade(TradeSide.BUY, 10, 0.40));
    position.addTrade(trade(TradeSide.SELL, 3, 0.35));

    assertThat(position.getNetQuantity()).isEqualTo(7);
    assertThat(position.getCostBasis()).isEqualTo(Money.of("2.95"));
    assertThat(position.getAverageCostPerContract()).isEqualTo(Money.of("2.95").divide(7));
    assertThat(position.getTrades()).hasSize(2);
  }

  @Test
  void removingATradeRestoresThePreviousState() {
    Position position = new Position("u1", 0.5);
    position.addTrade(trade(TradeSide.BUY, 10, 0.40));
    Trade sell = trade(TradeSide.SELL, 4, 0.30);
    position.addTrade(sell);

    assertThat(position.removeTrade(sell)).isTrue();

    assertThat(position.getNetQuantity()).isEqualTo(10);
    assertThat(position.getCostBasis()).isEqualTo(Money.of("4.00"));
    assertThat(position.removeTrade(sell)).isFalse();
  }

  @Test
  void unrealizedPnlMarksToPrice() {
    Position position = new Position("u1", 0.5);
    position.addTrade(trade(TradeSide.BUY, 10, 0.40));

    assertThat(position.unrealizedPnl(0.45)).isEqualTo(Money.of("0.50"));
    assertThat(new Position("u1", 0.5).getAverageCostPerContract()).isEqualTo(Money.ZERO);
  }

  @Test
  void settlementPaysCallPayoffOnce() {
    Position position = new Position("u1", 0.5);
    position.addTrade(trade(TradeSide.BUY, 7, 0.40));

    Money first = position.settle(65.0);
    Money second = position.settle(99.0);

    assertThat(first).isEqualTo(Money.of("1.05"));
    assertThat(second).isEqualTo(first);
    assertThat(position.getStatus()).isEqualTo(PositionStatus.SETTLED);
    assertThat(position.unrealizedPnl(0.9)).isEqualTo(Money.ZERO);
    assertThatThrownBy(() -> position.addTrade(trade(TradeSide.BUY, 1, 0.1)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void outOfTheMoneySettlesAtZero() {
    Position position = new Position("u1", 0.5);
    position.addTrade(trade(TradeSide.BUY, 5, 0.20));

    assertThat(position.settle(30.0)).isEqualTo(Money.ZERO);
  }
}
