package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;

import java.util.Arrays;
import java.util.List;

/**
 * Relative Strength Index indicator with Wilder smoothing.
 */
public final class RSI {

    private RSI() {} // Utility class

    public static double[] calculate(List<PriceBar> bars, int period) {
        return calculate(IndicatorColumns.closes(bars), period);
    }

    /**
     * Calculate RSI for all values.
     * @return Array where index corresponds to input index. The first valid value is at
     *         index {@code period}; earlier values are Double.NaN.
     */
    public static double[] calculate(double[] closes, int period) {
        int n = closes.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (n < period + 1 || period <= 0) {
            return result;
        }

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }

        avgGain /= period;
        avgLoss /= period;
        result[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = closes[i] - closes[i - 1];
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? Math.abs(change) : 0;

            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            result[i] = toRsi(avgGain, avgLoss);
        }

        return result;
    }

    private static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return avgGain == 0 ? 50 : 100;
        }
        double rs = avgGain / avgLoss;
        return 100 - (100 / (1 + rs));
    }
}
