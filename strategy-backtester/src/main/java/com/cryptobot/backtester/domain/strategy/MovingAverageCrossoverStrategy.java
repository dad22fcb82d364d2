package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.ParameterValidationException;
import com.cryptobot.backtester.indicators.EMA;
import com.cryptobot.backtester.indicators.IndicatorColumns;
import com.cryptobot.backtester.indicators.SMA;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moving Average Crossover Strategy.
 * Buys when the fast MA crosses above the slow MA, sells when it crosses below.
 * A bar where the averages are equal still counts as "not yet crossed".
 */
@Slf4j
@Getter
public class MovingAverageCrossoverStrategy extends AbstractStrategy {

    private final int fastPeriod;
    private final int slowPeriod;
    private final MovingAverageType maType;

    public MovingAverageCrossoverStrategy(int fastPeriod, int slowPeriod, MovingAverageType maType) {
        if (fastPeriod <= 0) {
            throw new ParameterValidationException("Fast period must be positive");
        }
        if (fastPeriod >= slowPeriod) {
            throw new ParameterValidationException("Fast period must be less than slow period");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.maType = maType == null ? MovingAverageType.SMA : maType;
    }

    public MovingAverageCrossoverStrategy(int fastPeriod, int slowPeriod) {
        this(fastPeriod, slowPeriod, MovingAverageType.SMA);
    }

    @Override
    protected List<SignaledBar> computeSignals(List<PriceBar> bars) {
        String fastColumn = IndicatorColumns.movingAverage(maType.name(), fastPeriod);
        String slowColumn = IndicatorColumns.movingAverage(maType.name(), slowPeriod);

        double[] fast = movingAverage(bars, fastColumn, fastPeriod);
        double[] slow = movingAverage(bars, slowColumn, slowPeriod);

        if (IndicatorColumns.allNaN(slow)) {
            log.warn("Insufficient data for {}{}: need {} bars, have {}. No signals generated.",
                    maType, slowPeriod, slowPeriod, bars.size());
            return allHold(bars);
        }

        List<SignaledBar> result = new ArrayList<>(bars.size());
        result.add(signaled(bars.get(0), Signal.HOLD, 0, fastColumn, fast[0], slowColumn, slow[0]));

        for (int i = 1; i < bars.size(); i++) {
            Signal signal = Signal.HOLD;
            double strength = 0;

            if (!Double.isNaN(fast[i]) && !Double.isNaN(slow[i])
                    && !Double.isNaN(fast[i - 1]) && !Double.isNaN(slow[i - 1])) {
                if (fast[i - 1] <= slow[i - 1] && fast[i] > slow[i]) {
                    signal = Signal.BUY;
                    strength = 1;
                    log.debug("BUY signal at {} ({}: {}, {}: {})",
                            bars.get(i).getTimestamp(), fastColumn, fast[i], slowColumn, slow[i]);
                } else if (fast[i - 1] >= slow[i - 1] && fast[i] < slow[i]) {
                    signal = Signal.SELL;
                    strength = -1;
                    log.debug("SELL signal at {} ({}: {}, {}: {})",
                            bars.get(i).getTimestamp(), fastColumn, fast[i], slowColumn, slow[i]);
                }
            }

            result.add(signaled(bars.get(i), signal, strength, fastColumn, fast[i], slowColumn, slow[i]));
        }

        return result;
    }

    private double[] movingAverage(List<PriceBar> bars, String column, int period) {
        double[] precomputed = IndicatorColumns.precomputed(bars, column);
        if (precomputed != null) {
            return precomputed;
        }
        return maType == MovingAverageType.EMA
                ? EMA.calculate(bars, period)
                : SMA.calculate(bars, period);
    }

    private static SignaledBar signaled(PriceBar bar, Signal signal, double strength,
            String fastColumn, double fast, String slowColumn, double slow) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(fastColumn, fast);
        values.put(slowColumn, slow);
        return SignaledBar.builder()
                .bar(bar)
                .signal(signal)
                .signalStrength(strength)
                .indicatorValues(values)
                .build();
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + maType + "," + fastPeriod + "," + slowPeriod + ")";
    }

    @Override
    public String getDescription() {
        return "Buy when " + maType + fastPeriod + " crosses above " + maType + slowPeriod
                + ", sell when it crosses below";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fastPeriod", fastPeriod);
        params.put("slowPeriod", slowPeriod);
        params.put("maType", maType.name());
        return params;
    }
}
