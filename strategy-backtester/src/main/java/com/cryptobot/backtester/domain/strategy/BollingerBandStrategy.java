package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.ParameterValidationException;
import com.cryptobot.backtester.indicators.BollingerBands;
import com.cryptobot.backtester.indicators.IndicatorColumns;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Band reversion: BUY when the close touches the lower band, SELL at the upper band.
 * Precomputed {@code bb_upper} and {@code bb_lower} columns are read only for the standard 20-period, 2-sigma bands.
 */
@Slf4j
@Getter
public class BollingerBandStrategy extends AbstractStrategy {

    public static final int DEFAULT_PERIOD = 20;
    public static final double DEFAULT_STD_DEV_MULTIPLIER = 2.0;

    private final int period;
    private final double stdDevMultiplier;

    public BollingerBandStrategy(int period, double stdDevMultiplier) {
        if (period < 2) {
            throw new ParameterValidationException("Bollinger period must be at least 2");
        }
        if (stdDevMultiplier <= 0) {
            throw new ParameterValidationException("Standard deviation multiplier must be positive");
        }
        this.period = period;
        this.stdDevMultiplier = stdDevMultiplier;
    }

    @Override
    protected List<SignaledBar> computeSignals(List<PriceBar> bars) {
        double[] upper = null;
        double[] lower = null;
        if (period == DEFAULT_PERIOD && stdDevMultiplier == DEFAULT_STD_DEV_MULTIPLIER) {
            upper = IndicatorColumns.precomputed(bars, IndicatorColumns.BB_UPPER);
            lower = IndicatorColumns.precomputed(bars, IndicatorColumns.BB_LOWER);
        }
        if (upper == null || lower == null) {
            BollingerBands.Result bands = BollingerBands.calculate(bars, period, stdDevMultiplier);
            upper = bands.getUpper();
            lower = bands.getLower();
        }

        if (IndicatorColumns.allNaN(upper)) {
            log.warn("Insufficient data for Bollinger Bands({}): have {} bars. No signals generated.",
                    period, bars.size());
            return allHold(bars);
        }

        List<SignaledBar> result = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            double close = bars.get(i).getClose().doubleValue();
            Signal signal = Signal.HOLD;
            double strength = 0;

            if (!Double.isNaN(upper[i]) && !Double.isNaN(lower[i])) {
                if (close <= lower[i]) {
                    signal = Signal.BUY;
                    strength = 1;
                } else if (close >= upper[i]) {
                    signal = Signal.SELL;
                    strength = -1;
                }
            }

            Map<String, Double> values = new LinkedHashMap<>();
            values.put(IndicatorColumns.BB_UPPER, upper[i]);
            values.put(IndicatorColumns.BB_LOWER, lower[i]);
            result.add(SignaledBar.builder()
                    .bar(bars.get(i))
                    .signal(signal)
                    .signalStrength(strength)
                    .indicatorValues(values)
                    .build());
        }
        return result;
    }

    @Override
    public String getName() {
        return "BollingerBands(" + period + "," + stdDevMultiplier + ")";
    }

    @Override
    public String getDescription() {
        return "Buy at the lower band, sell at the upper band";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("period", period);
        params.put("stdDevMultiplier", stdDevMultiplier);
        return params;
    }
}
