package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;
import lombok.Value;

import java.util.List;

/**
 * Bollinger Bands: SMA middle band with upper/lower bands at k population standard deviations.
 */
public final class BollingerBands {

    private BollingerBands() {} // Utility class

    @Value
    public static class Result {
        double[] upper;
        double[] middle;
        double[] lower;
    }

    public static Result calculate(List<PriceBar> bars, int period, double stdDevMultiplier) {
        double[] closes = IndicatorColumns.closes(bars);
        double[] middle = SMA.calculate(closes, period);

        int n = closes.length;
        double[] upper = new double[n];
        double[] lower = new double[n];

        for (int i = 0; i < n; i++) {
            if (Double.isNaN(middle[i])) {
                upper[i] = Double.NaN;
                lower[i] = Double.NaN;
                continue;
            }
            double sumSq = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = closes[j] - middle[i];
                sumSq += diff * diff;
            }
            double stdDev = Math.sqrt(sumSq / period);
            upper[i] = middle[i] + stdDevMultiplier * stdDev;
            lower[i] = middle[i] - stdDevMultiplier * stdDev;
        }

        return new Result(upper, middle, lower);
    }
}
