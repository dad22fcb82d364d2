package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One row of a strategy comparison.
 */
@Value
@Builder
public class StrategyComparison {
    String strategyName;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;

    /**
     * Completed round trips.
     */
    int numTrades;

    BigDecimal winRate;
    BigDecimal profitFactor;

    public static StrategyComparison of(String strategyName, PerformanceReport performance) {
        return StrategyComparison.builder()
                .strategyName(strategyName)
                .totalReturn(performance.getTotalReturn())
                .totalReturnPct(performance.getTotalReturnPct())
                .sharpeRatio(performance.getSharpeRatio())
                .maxDrawdown(performance.getMaxDrawdown())
                .numTrades(performance.getNumCompletedTrades())
                .winRate(performance.getWinRate())
                .profitFactor(performance.getProfitFactor())
                .build();
    }
}
