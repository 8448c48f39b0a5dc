package com.prediction.market.options_market.entity;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * One emitted point of the underlying price path.
 *
 * Price is on the 0-100 scale (probability x 100). Volume and spread are
 * market color only; nothing prices off them. Points are immutable: the
 * engine hands the same instance to every subscriber and replaces (never
 * mutates) the last history entry when it applies the terminal adjustment.
 */
@Value
@Builder(toBuilder = true)
public class PricePoint {
    long sequenceIndex;
    Instant timestamp;
    double price;
    double movement;
    int volume;
    double bidAskSpread;

    /**
     * Outcome committed by the engine, null for feeds that do not know it.
     */
    Boolean resolvedOutcome;
}
