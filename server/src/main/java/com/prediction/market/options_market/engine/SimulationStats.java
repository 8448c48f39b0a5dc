package com.prediction.market.options_market.engine;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimulationStats {
    SimulationState state;
    int currentPoint;
    int totalPoints;
    double progressPercent;
    double currentPrice;
    String targetResolution;
    boolean trending;
    Duration timeInterval;
}
