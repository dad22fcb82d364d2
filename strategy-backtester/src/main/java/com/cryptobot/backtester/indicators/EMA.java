package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;

import java.util.Arrays;
import java.util.List;

/**
 * Exponential Moving Average indicator.
 */
public final class EMA {

    private EMA() {} // Utility class

    public static double[] calculate(List<PriceBar> bars, int period) {
        return calculate(IndicatorColumns.closes(bars), period);
    }

    /**
     * Calculate EMA for all values. NaN inputs before the first valid value are skipped,
     * so the result can be chained on another indicator (MACD signal line).
     * @return Array where index corresponds to input index. Warmup values are Double.NaN.
     */
    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0) {
            return result;
        }

        int start = 0;
        while (start < n && Double.isNaN(values[start])) {
            start++;
        }
        if (n - start < period) {
            return result;
        }

        double multiplier = 2.0 / (period + 1);

        // First EMA is SMA
        double sum = 0;
        for (int i = start; i < start + period; i++) {
            sum += values[i];
        }
        int seed = start + period - 1;
        result[seed] = sum / period;

        for (int i = seed + 1; i < n; i++) {
            result[i] = (values[i] - result[i - 1]) * multiplier + result[i - 1];
        }

        return result;
    }
}
