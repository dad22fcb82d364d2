package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only aggregate of a run's performance.
 * Percentages (return, win rate, drawdown) are expressed in percent, not fractions.
 */
@Value
@Builder
public class PerformanceReport {

    BigDecimal initialCapital;
    BigDecimal finalValue;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    int numTrades;
    int numCompletedTrades;
    BigDecimal winRate;

    /**
     * Gross profit over gross loss; null when completed trades include no losses.
     */
    BigDecimal profitFactor;

    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
    BigDecimal maxDrawdownValue;
    BigDecimal avgWin;
    BigDecimal avgLoss;
    BigDecimal avgTrade;
    BigDecimal largestWin;
    BigDecimal largestLoss;
}
