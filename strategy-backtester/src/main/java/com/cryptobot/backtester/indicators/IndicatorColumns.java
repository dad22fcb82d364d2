package com.cryptobot.backtester.indicators;

import com.cryptobot.backtester.domain.PriceBar;

import java.util.List;
import java.util.Locale;

/**
 * Column naming and extraction helpers shared by indicators and strategies.
 */
public final class IndicatorColumns {

    public static final String RSI = "rsi";
    public static final String MACD = "macd";
    public static final String MACD_SIGNAL = "macd_signal";
    public static final String BB_UPPER = "bb_upper";
    public static final String BB_MIDDLE = "bb_middle";
    public static final String BB_LOWER = "bb_lower";
    public static final String ATR = "atr";

    private IndicatorColumns() {} // Utility class

    /**
     * Column name for a moving average, e.g. {@code sma_10} or {@code ema_20}.
     */
    public static String movingAverage(String maType, int period) {
        return maType.toLowerCase(Locale.ROOT) + "_" + period;
    }

    public static double[] closes(List<PriceBar> bars) {
        double[] result = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            result[i] = bars.get(i).getClose().doubleValue();
        }
        return result;
    }

    /**
     * Read a precomputed column if every bar carries it.
     *
     * @return the column values, or null when at least one bar lacks the column
     */
    public static double[] precomputed(List<PriceBar> bars, String column) {
        if (bars.isEmpty()) {
            return null;
        }
        double[] result = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            if (!bar.hasIndicator(column)) {
                return null;
            }
            result[i] = bar.getIndicator(column);
        }
        return result;
    }

    /**
     * True if every value in the array is NaN (series too short for the window).
     */
    public static boolean allNaN(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) {
                return false;
            }
        }
        return true;
    }
}
