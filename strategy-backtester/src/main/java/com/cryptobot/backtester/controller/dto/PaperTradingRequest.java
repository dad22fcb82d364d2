package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.engine.paper.SizingMethod;
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
 * Request DTO for a paper-trading session.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
public class PaperTradingRequest extends MarketDataRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @DecimalMin(value = "0", inclusive = false, message = "Position size must be positive")
    @DecimalMax(value = "1", message = "Position size must not exceed 1")
    private BigDecimal positionSize;

    @DecimalMin(value = "0", inclusive = false, message = "Stop-loss percentage must be positive")
    @DecimalMax(value = "1", inclusive = false, message = "Stop-loss percentage must be below 1")
    private BigDecimal stopLossPct;

    @DecimalMin(value = "0", inclusive = false, message = "Take-profit percentage must be positive")
    private BigDecimal takeProfitPct;

    @DecimalMin(value = "0", inclusive = false, message = "Trailing stop percentage must be positive")
    @DecimalMax(value = "1", inclusive = false, message = "Trailing stop percentage must be below 1")
    private BigDecimal trailingStopPct;

    /**
     * Defaults to {@link SizingMethod#FIXED_FRACTION} using {@code positionSize}.
     */
    private SizingMethod sizingMethod;

    private boolean persist;
}
