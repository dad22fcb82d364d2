package com.cryptobot.backtester.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for backtesting several strategies over the same bars.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
public class ComparisonRequest extends MarketDataRequest {

    @NotEmpty(message = "At least one strategy is required")
    private List<@Valid StrategySpec> strategies;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0", message = "Commission must not be negative")
    private BigDecimal commission;

    @DecimalMin(value = "0", message = "Slippage must not be negative")
    private BigDecimal slippage;

    private boolean persist;
}
