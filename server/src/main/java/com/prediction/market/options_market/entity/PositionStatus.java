package com.prediction.market.options_market.entity;

/**
 * OPEN until the market resolves, then SETTLED. SETTLED is terminal.
 */
public enum PositionStatus {
    OPEN,
    SETTLED
}
