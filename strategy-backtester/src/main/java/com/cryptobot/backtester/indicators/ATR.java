package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;

import java.util.Arrays;
import java.util.List;

/**
 * Average True Range indicator.
 */
public final class ATR {

    private ATR() {} // Utility class

    /**
     * Calculate ATR for all bars. Bars without high/low fall back to their close.
     * @return Array where index corresponds to bar index. Warmup values are Double.NaN.
     */
    public static double[] calculate(List<PriceBar> bars, int period) {
        int n = bars.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (n < period + 1 || period <= 0) {
            return result;
        }

        double[] tr = new double[n];
        tr[0] = high(bars.get(0)) - low(bars.get(0));

        for (int i = 1; i < n; i++) {
            PriceBar curr = bars.get(i);
            double prevClose = bars.get(i - 1).getClose().doubleValue();

            double highLow = high(curr) - low(curr);
            double highPrevClose = Math.abs(high(curr) - prevClose);
            double lowPrevClose = Math.abs(low(curr) - prevClose);

            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        // First ATR is SMA of TR
        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += tr[i];
        }
        result[period - 1] = sum / period;

        // Wilder's smoothing
        for (int i = period; i < n; i++) {
            result[i] = (result[i - 1] * (period - 1) + tr[i]) / period;
        }

        return result;
    }

    private static double high(PriceBar bar) {
        return (bar.getHigh() != null ? bar.getHigh() : bar.getClose()).doubleValue();
    }

    private static double low(PriceBar bar) {
        return (bar.getLow() != null ? bar.getLow() : bar.getClose()).doubleValue();
    }
}
