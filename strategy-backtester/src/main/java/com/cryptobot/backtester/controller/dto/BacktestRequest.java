package com.cryptobot.backtester.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for running a single backtest.
 * Capital, sizing and cost fields fall back to the configured defaults when omitted.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
public class BacktestRequest extends MarketDataRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0", message = "Commission must not be negative")
    private BigDecimal commission;

    @DecimalMin(value = "0", message = "Slippage must not be negative")
    private BigDecimal slippage;

    @DecimalMin(value = "0", inclusive = false, message = "Position size must be positive")
    @DecimalMax(value = "1", message = "Position size must not exceed 1")
    private BigDecimal positionSize;

    private boolean persist;
}
