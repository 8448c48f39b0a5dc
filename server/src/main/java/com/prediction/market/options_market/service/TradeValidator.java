package com.prediction.market.options_market.service;

import java.util.Locale;

import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.entity.TradeSide;

import lombok.extern.slf4j.Slf4j;

/**
 * Business rules a trade request must pass before it touches the book.
 *
 * Checks are read-only and run in the order the ledger calls them; the first
 * failure is the rejection reason returned to the caller.
 */
@Slf4j
public class TradeValidator {

    /**
     * Result of one validation step.
     */
    public static class ValidationResult {
        private static final ValidationResult VALID = new ValidationResult(true, null);

        private final boolean valid;
        private final String errorMessage;

        private ValidationResult(boolean valid, String errorMessage) {
            this.valid = valid;
            this.errorMessage = errorMessage;
        }

        public static ValidationResult valid() {
            return VALID;
        }

        public static ValidationResult invalid(String errorMessage) {
            return new ValidationResult(false, errorMessage);
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }

    public ValidationResult validateRequest(boolean marketResolved, int quantity, TradeSide side) {
        if (marketResolved) {
            return ValidationResult.invalid("Market has already resolved - no more trading allowed");
        }
        if (quantity <= 0) {
            return ValidationResult.invalid("Quantity must be positive");
        }
        if (side == null) {
            return ValidationResult.invalid("Side must be BUY or SELL");
        }
        return ValidationResult.valid();
    }

    public ValidationResult validatePrice(double pricePerContract) {
        if (!Double.isFinite(pricePerContract) || pricePerContract <= 0) {
            return ValidationResult.invalid("Invalid option price: " + pricePerContract);
        }
        return ValidationResult.valid();
    }

    public ValidationResult validateBuy(int currentNet, int quantity, int positionLimit, Money cost, Money cash) {
        if ((long) currentNet + quantity > positionLimit) {
            return ValidationResult.invalid(
                String.format("Would exceed position limit of %d contracts", positionLimit));
        }
        if (!cost.isPositive()) {
            return ValidationResult.invalid("Invalid total cost: " + cost);
        }
        if (cash.isLessThan(cost)) {
            return ValidationResult.invalid(String.format(Locale.ROOT,
                "Insufficient cash. Need $%.2f, have $%.2f", cost.toBigDecimal(), cash.toBigDecimal()));
        }
        return ValidationResult.valid();
    }

    public ValidationResult validateSell(int currentNet, int quantity) {
        if (quantity > currentNet) {
            return ValidationResult.invalid(
                String.format("Cannot sell %d contracts, only own %d", quantity, Math.max(currentNet, 0)));
        }
        return ValidationResult.valid();
    }

    /**
     * max(minLiquidity, floor(cash * fraction / ask)); the cash term counts
     * as zero when the ask cannot be divided by.
     */
    public int positionLimit(Money cash, double askPrice, double maxPositionFraction, int minLiquidity) {
        long cashBased = 0;
        if (Double.isFinite(askPrice) && askPrice > 0) {
            double raw = Math.floor(cash.toDouble() * maxPositionFraction / askPrice);
            cashBased = raw >= Integer.MAX_VALUE ? Integer.MAX_VALUE : Math.max(0L, (long) raw);
        } else {
            log.debug("Position limit falls back to minimum liquidity, ask={}", askPrice);
        }
        return (int) Math.max(minLiquidity, cashBased);
    }
}
