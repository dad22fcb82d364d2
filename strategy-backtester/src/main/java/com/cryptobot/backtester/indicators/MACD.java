package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;
import lombok.Value;

import java.util.List;

/**
 * Moving Average Convergence Divergence.
 */
public final class MACD {

    private MACD() {} // Utility class

    /**
     * MACD line, signal line and histogram, each aligned with the input bars.
     */
    @Value
    public static class Result {
        double[] macd;
        double[] signal;
        double[] histogram;
    }

    public static Result calculate(List<PriceBar> bars, int fastPeriod, int slowPeriod, int signalPeriod) {
        double[] closes = IndicatorColumns.closes(bars);
        double[] fast = EMA.calculate(closes, fastPeriod);
        double[] slow = EMA.calculate(closes, slowPeriod);

        int n = closes.length;
        double[] macd = new double[n];
        for (int i = 0; i < n; i++) {
            macd[i] = fast[i] - slow[i];
        }

        double[] signal = EMA.calculate(macd, signalPeriod);
        double[] histogram = new double[n];
        for (int i = 0; i < n; i++) {
            histogram[i] = macd[i] - signal[i];
        }
        return new Result(macd, signal, histogram);
    }
}
