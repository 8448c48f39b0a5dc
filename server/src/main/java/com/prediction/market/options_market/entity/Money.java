package com.prediction.market.options_market.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-precision money type for cash, trade costs, settlements and P&L.
 *
 * Option prices are doubles produced by the pricing engine; they are converted
 * once, at the point a cash amount is derived from them, and never re-enter
 * floating point afterwards. This keeps position cost bases exactly equal to
 * the fold of their trades.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for all monetary values (8 decimal places).
     */
    public static final int SCALE = 8;

    /**
     * HALF_EVEN (banker's rounding) for every operation.
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    /**
     * Create Money from a double price or amount.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static Money of(double amount) {
        if (!Double.isFinite(amount)) {
            throw new IllegalArgumentException("Amount must be finite: " + amount);
        }
        return new Money(BigDecimal.valueOf(amount));
    }

    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    /**
     * Create Money from String (persisted values, configuration).
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return new Money(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    /**
     * Per-contract price times a contract count.
     */
    public static Money ofContracts(double pricePerContract, int contracts) {
        return of(pricePerContract).multiply(contracts);
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public Money multiply(int scalar) {
        return new Money(this.amount.multiply(BigDecimal.valueOf(scalar)));
    }

    public Money divide(int scalar) {
        if (scalar == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new Money(this.amount.divide(BigDecimal.valueOf(scalar), SCALE, ROUNDING_MODE));
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    public Money abs() {
        return new Money(this.amount.abs());
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    public boolean isZero() {
        return this.amount.signum() == 0;
    }

    public boolean isLessThan(Money other) {
        return this.compareTo(other) < 0;
    }

    /**
     * Underlying BigDecimal (persistence and exact comparisons).
     */
    public BigDecimal toBigDecimal() {
        return amount;
    }

    /**
     * Convert to double (display and ratio calculations only).
     */
    public double toDouble() {
        return amount.doubleValue();
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
