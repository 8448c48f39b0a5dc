package com.prediction.market.options_market.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.prediction.market.options_market.engine.SimulationMode;
import com.prediction.market.options_market.engine.SimulationSettings;
import com.prediction.market.options_market.entity.Money;
import com.prediction.market.options_market.service.LedgerSettings;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    @Valid
    private Simulation simulation = new Simulation();

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private Export export = new Export();

    public enum StoreType {
        MONGO, MEMORY
    }

    @Getter
    @Setter
    public static class Simulation {
        @Min(1)
        private int totalPoints = 1500;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double initialPrice = 50.0;

        @DecimalMin("0.0")
        private double volatility = 1.8;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double thresholdFraction = 0.7;

        @DecimalMin("0.0")
        private double trendStrength = 0.08;

        @DecimalMin(value = "0.0", inclusive = false)
        private double maxMovementPerStep = 4.0;

        /**
         * Fixed outcome for reproducible runs; unset draws it at random.
         */
        private Boolean forcedOutcome;

        @NotNull
        private Duration interval = Duration.ofSeconds(1);

        @NotNull
        private SimulationMode mode = SimulationMode.AUTO;

        /**
         * Start the run as soon as the application is up.
         */
        private boolean autoStart = false;

        public SimulationSettings toSettings() {
            return SimulationSettings.builder()
                .totalPoints(totalPoints)
                .initialPrice(initialPrice)
                .volatility(volatility)
                .thresholdFraction(thresholdFraction)
                .trendStrength(trendStrength)
                .maxMovementPerStep(maxMovementPerStep)
                .forcedOutcome(forcedOutcome)
                .build();
        }
    }

    @Getter
    @Setter
    public static class Ledger {
        @NotNull
        private StoreType store = StoreType.MEMORY;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal startingCash = new BigDecimal("15000");

        @NotEmpty
        private List<Double> strikes = new ArrayList<>(List.of(0.3, 0.4, 0.5, 0.6, 0.7, 0.8));

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double maxPositionFraction = 0.2;

        @Min(0)
        private int minLiquidity = 10;

        @DecimalMin("0.0")
        private double decayRate = 1.5;

        /**
         * Rebuild users and positions from the store at startup.
         */
        private boolean restoreOnStartup = true;

        public LedgerSettings toSettings() {
            return LedgerSettings.builder()
                .strikes(List.copyOf(strikes))
                .maxPositionFraction(maxPositionFraction)
                .minLiquidity(minLiquidity)
                .decayRate(decayRate)
                .defaultStartingCash(Money.of(startingCash))
                .build();
        }
    }

    @Getter
    @Setter
    public static class Persistence {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryWait = Duration.ofMillis(200);
    }

    @Getter
    @Setter
    public static class Export {
        private boolean enabled = false;

        @NotBlank
        private String directory = "data/live";

        /**
         * Overrides the generated file name.
         */
        private String fileName;
    }
}
