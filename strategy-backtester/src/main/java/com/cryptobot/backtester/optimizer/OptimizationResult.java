package com.cryptobot.backtester.optimizer;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Headline metrics of one parameter combination.
 */
@Value
@Builder
public class OptimizationResult {
    Map<String, Object> parameters;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;

    /**
     * Completed round trips.
     */
    int numTrades;

    BigDecimal winRate;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
}
