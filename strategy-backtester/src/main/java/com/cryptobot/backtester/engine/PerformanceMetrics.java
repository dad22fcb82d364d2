package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.Trade;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics.
 * Reported figures are rounded to 4 decimal places.
 */
@Slf4j
public final class PerformanceMetrics {

    public static final int REPORT_SCALE = 4;
    private static final int CALC_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final double TRADING_DAYS = 252;

    private PerformanceMetrics() {} // Utility class

    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        return finalValue.subtract(initialCapital).setScale(REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturnPct(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialCapital)
                .multiply(HUNDRED)
                .divide(initialCapital, REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Simple period returns. Points following a non-positive value are skipped.
     */
    public static List<BigDecimal> calculateReturns(List<BigDecimal> portfolioValues) {
        List<BigDecimal> returns = new ArrayList<>();
        for (int i = 1; i < portfolioValues.size(); i++) {
            BigDecimal prevValue = portfolioValues.get(i - 1);
            BigDecimal currentValue = portfolioValues.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) > 0) {
                returns.add(currentValue.subtract(prevValue)
                        .divide(prevValue, CALC_SCALE, RoundingMode.HALF_UP));
            }
        }
        return returns;
    }

    /**
     * Annualized Sharpe ratio with a zero risk-free rate, using the sample
     * standard deviation and 252 periods per year.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> portfolioValues) {
        List<BigDecimal> returns = calculateReturns(portfolioValues);
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        BigDecimal sumReturns = returns.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal meanReturn = sumReturns.divide(
                BigDecimal.valueOf(returns.size()), CALC_SCALE, RoundingMode.HALF_UP);

        BigDecimal sumSquaredDiff = returns.stream()
                .map(r -> r.subtract(meanReturn).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        double variance = sumSquaredDiff.divide(
                BigDecimal.valueOf(returns.size() - 1L), CALC_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
        double stdDev = Math.sqrt(variance);

        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }

        double sharpe = (meanReturn.doubleValue() / stdDev) * Math.sqrt(TRADING_DAYS);
        return BigDecimal.valueOf(sharpe).setScale(REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate maximum drawdown percentage, as a value at or below zero.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> portfolioValues) {
        if (portfolioValues.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = portfolioValues.get(0);

        for (BigDecimal value : portfolioValues) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .multiply(HUNDRED)
                        .divide(peak, REPORT_SCALE, RoundingMode.HALF_UP);

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.negate();
    }

    /**
     * Largest absolute drop from a running peak, as a value at or below zero.
     */
    public static BigDecimal calculateMaxDrawdownValue(List<BigDecimal> portfolioValues) {
        if (portfolioValues.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal maxDrop = BigDecimal.ZERO;
        BigDecimal peak = portfolioValues.get(0);

        for (BigDecimal value : portfolioValues) {
            peak = peak.max(value);
            maxDrop = maxDrop.max(peak.subtract(value));
        }

        return maxDrop.negate().setScale(REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate win rate (percentage of profitable round trips).
     */
    public static BigDecimal calculateWinRate(List<CompletedTrade> completed) {
        if (completed.isEmpty()) {
            return BigDecimal.ZERO;
        }

        long winningTrades = completed.stream()
                .filter(t -> t.getProfit().signum() > 0)
                .count();

        return BigDecimal.valueOf(winningTrades)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(completed.size()), REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss.
     *
     * @return 0 without completed trades, null when there are completed trades but no losses
     */
    public static BigDecimal calculateProfitFactor(List<CompletedTrade> completed) {
        if (completed.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        for (CompletedTrade trade : completed) {
            if (trade.getProfit().signum() > 0) {
                grossProfit = grossProfit.add(trade.getProfit());
            } else if (trade.getProfit().signum() < 0) {
                grossLoss = grossLoss.add(trade.getProfit().abs());
            }
        }

        if (grossLoss.signum() == 0) {
            return null;
        }
        return grossProfit.divide(grossLoss, REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Combine ledger, equity curve and final value into a report.
     * Calling it twice on the same inputs yields equal reports.
     */
    public static PerformanceReport buildReport(BigDecimal initialCapital, BigDecimal finalValue,
            List<Trade> trades, List<EquityPoint> equityCurve) {
        List<BigDecimal> values = EquityCurveBuilder.values(equityCurve);
        List<CompletedTrade> completed = TradePairing.pair(trades);

        List<BigDecimal> wins = new ArrayList<>();
        List<BigDecimal> losses = new ArrayList<>();
        BigDecimal sumProfits = BigDecimal.ZERO;
        for (CompletedTrade trade : completed) {
            sumProfits = sumProfits.add(trade.getProfit());
            if (trade.getProfit().signum() > 0) {
                wins.add(trade.getProfit());
            } else if (trade.getProfit().signum() < 0) {
                losses.add(trade.getProfit());
            }
        }

        PerformanceReport report = PerformanceReport.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue.setScale(REPORT_SCALE, RoundingMode.HALF_UP))
                .totalReturn(calculateTotalReturn(initialCapital, finalValue))
                .totalReturnPct(calculateTotalReturnPct(initialCapital, finalValue))
                .numTrades(trades.size())
                .numCompletedTrades(completed.size())
                .winRate(calculateWinRate(completed))
                .profitFactor(calculateProfitFactor(completed))
                .sharpeRatio(calculateSharpeRatio(values))
                .maxDrawdown(calculateMaxDrawdown(values))
                .maxDrawdownValue(calculateMaxDrawdownValue(values))
                .avgWin(mean(wins))
                .avgLoss(mean(losses))
                .avgTrade(completed.isEmpty()
                        ? BigDecimal.ZERO
                        : sumProfits.divide(BigDecimal.valueOf(completed.size()), REPORT_SCALE, RoundingMode.HALF_UP))
                .largestWin(wins.stream().reduce(BigDecimal::max)
                        .orElse(BigDecimal.ZERO).setScale(REPORT_SCALE, RoundingMode.HALF_UP))
                .largestLoss(losses.stream().reduce(BigDecimal::min)
                        .orElse(BigDecimal.ZERO).setScale(REPORT_SCALE, RoundingMode.HALF_UP))
                .build();

        log.debug("Performance - Return: {}%, Sharpe: {}, Max DD: {}%, Win Rate: {}%, Completed: {}",
                report.getTotalReturnPct(), report.getSharpeRatio(), report.getMaxDrawdown(),
                report.getWinRate(), report.getNumCompletedTrades());
        return report;
    }

    private static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return values.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(values.size()), REPORT_SCALE, RoundingMode.HALF_UP);
    }
}
