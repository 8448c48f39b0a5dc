package com.prediction.market.options_market.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.TradeSide;

class TradeValidatorTest {

  private final TradeValidator validator = new TradeValidator();

  @Test
  void positionLimitUsesMinimumLiquidityFloor() {
    assertThat(validator.positionLimit(Money.of(15_000L), 0.40, 0.2, 10)).isEqualTo(7500);
    assertThat(validator.positionLimit(Money.of(1L), 0.40, 0.2, 10)).isEqualTo(10);
    assertThat(validator.positionLimit(Money.of(15_000L), 0.0, 0.2, 10)).isEqualTo(10);
    assertThat(validator.positionLimit(Money.of(15_000L), Double.NaN, 0.2, 10)).isEqualTo(10);
  }

  @Test
  void requestChecksRunInOrder() {
    assertThat(validator.validateRequest(true, 0, null).getErrorMessage())
        .isEqualTo("Market has already resolved - no more trading allowed");
    assertThat(validator.validateRequest(false, 0, null).getErrorMessage()).isEqualTo("Quantity must be positive");
    assertThat(validator.validateRequest(false, 1, null).isValid()).isFalse();
    assertThat(validator.validateRequest(false, 1, TradeSide.SELL).isValid()).isTrue();
  }

  @Test
  void priceMustBeFiniteAndPositive() {
    assertThat(validator.validatePrice(0.0).getErrorMessage()).isEqualTo("Invalid option price: 0.0");
    assertThat(validator.validatePrice(Double.POSITIVE_INFINITY).isValid()).isFalse();
    assertThat(validator.validatePrice(0.001).isValid()).isTrue();
  }

  @Test
  void buyChecksLimitBeforeCash() {
    assertThat(validator.validateBuy(8, 3, 10, Money.of("100"), Money.of("1")).getErrorMessage())
        .isEqualTo("Would exceed position limit of 10 contracts");
    assertThat(validator.validateBuy(7, 3, 10, Money.of("100"), Money.of("1")).getErrorMessage())
        .isEqualTo("Insufficient cash. Need $100.00, have $1.00");
    assertThat(validator.validateBuy(7, 3, 10, Money.of("1"), Money.of("1")).isValid()).isTrue();
  }

  @Test
  void sellIsBoundedByNetLong() {
    assertThat(validator.validateSell(5, 5).isValid()).isTrue();
    assertThat(validator.validateSell(5, 6).getErrorMessage()).isEqualTo("Cannot sell 6 contracts, only own 5");
  }
}
