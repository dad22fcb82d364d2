package com.cryptobot.backtester.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Run defaults bound from the {@code backtest.*} properties.
 * Immutable; request values override these per run.
 */
@Getter
@ToString
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private final BigDecimal initialCapital;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private final BigDecimal positionSize;

    @NotNull
    @DecimalMin("0")
    private final BigDecimal commission;

    @NotNull
    @DecimalMin("0")
    private final BigDecimal slippage;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private final BigDecimal stopLossPct;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private final BigDecimal takeProfitPct;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private final BigDecimal maxPortfolioRisk;

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private final BigDecimal maxKellyFraction;

    @Min(2)
    @Max(34)
    private final int calcScale;

    @Valid
    private final Optimizer optimizer;

    public BacktestProperties(
            @DefaultValue("10000") BigDecimal initialCapital,
            @DefaultValue("0.95") BigDecimal positionSize,
            @DefaultValue("0.001") BigDecimal commission,
            @DefaultValue("0.0005") BigDecimal slippage,
            @DefaultValue("0.02") BigDecimal stopLossPct,
            @DefaultValue("0.05") BigDecimal takeProfitPct,
            @DefaultValue("0.10") BigDecimal maxPortfolioRisk,
            @DefaultValue("0.5") BigDecimal maxKellyFraction,
            @DefaultValue("10") int calcScale,
            @DefaultValue Optimizer optimizer) {
        this.initialCapital = initialCapital;
        this.positionSize = positionSize;
        this.commission = commission;
        this.slippage = slippage;
        this.stopLossPct = stopLossPct;
        this.takeProfitPct = takeProfitPct;
        this.maxPortfolioRisk = maxPortfolioRisk;
        this.maxKellyFraction = maxKellyFraction;
        this.calcScale = calcScale;
        this.optimizer = optimizer;
    }

    @Getter
    @ToString
    public static class Optimizer {

        /**
         * Number of parameter combinations evaluated concurrently; 1 runs them in order on the caller's thread.
         */
        @Min(1)
        private final int parallelism;

        /**
         * Upper bound on the size of a parameter grid; larger grids are rejected before any trial runs.
         */
        @Min(1)
        private final int maxCombinations;

        public Optimizer(@DefaultValue("1") int parallelism, @DefaultValue("10000") int maxCombinations) {
            this.parallelism = parallelism;
            this.maxCombinations = maxCombinations;
        }
    }
}
