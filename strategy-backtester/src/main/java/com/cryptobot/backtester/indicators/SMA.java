package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;

import java.util.Arrays;
import java.util.List;

/**
 * Simple Moving Average indicator.
 */
public final class SMA {

    private SMA() {} // Utility class

    public static double[] calculate(List<PriceBar> bars, int period) {
        return calculate(IndicatorColumns.closes(bars), period);
    }

    /**
     * Calculate SMA for all values.
     * @return Array where index corresponds to input index. Warmup values are Double.NaN.
     */
    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (n < period || period <= 0) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                result[i] = sum / period;
            }
        }

        return result;
    }
}
