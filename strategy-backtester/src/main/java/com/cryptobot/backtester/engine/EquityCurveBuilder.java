package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Trade;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a step-function equity curve: one point per bar, holding the portfolio value
 * recorded by the most recent trade at or before that bar.
 */
public final class EquityCurveBuilder {

    private EquityCurveBuilder() {} // Utility class

    public static List<EquityPoint> build(List<PriceBar> bars, List<Trade> trades, BigDecimal initialCapital) {
        BigDecimal[] values = new BigDecimal[bars.size()];
        Arrays.fill(values, initialCapital);

        for (Trade trade : trades) {
            int start = firstIndexAtOrAfter(bars, trade);
            for (int i = start; i < values.length; i++) {
                values[i] = trade.getPortfolioValue();
            }
        }

        List<EquityPoint> curve = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            curve.add(new EquityPoint(bars.get(i).getTimestamp(), values[i]));
        }
        return curve;
    }

    public static List<BigDecimal> values(List<EquityPoint> curve) {
        List<BigDecimal> values = new ArrayList<>(curve.size());
        for (EquityPoint point : curve) {
            values.add(point.getPortfolioValue());
        }
        return values;
    }

    private static int firstIndexAtOrAfter(List<PriceBar> bars, Trade trade) {
        for (int i = 0; i < bars.size(); i++) {
            if (!bars.get(i).getTimestamp().isBefore(trade.getTimestamp())) {
                return i;
            }
        }
        return bars.size();
    }
}
