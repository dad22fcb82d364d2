package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.ParameterValidationException;
import com.cryptobot.backtester.indicators.IndicatorColumns;
import com.cryptobot.backtester.indicators.MACD;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buys when the MACD line crosses above its signal line and sells on the opposite cross.
 * Precomputed {@code macd} and {@code macd_signal} columns are read only for the standard 12/26/9 periods.
 */
@Slf4j
@Getter
public class MacdCrossoverStrategy extends AbstractStrategy {

    public static final int DEFAULT_FAST_PERIOD = 12;
    public static final int DEFAULT_SLOW_PERIOD = 26;
    public static final int DEFAULT_SIGNAL_PERIOD = 9;

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MacdCrossoverStrategy(int fastPeriod, int slowPeriod, int signalPeriod) {
        if (fastPeriod <= 0 || signalPeriod <= 0) {
            throw new ParameterValidationException("MACD periods must be positive");
        }
        if (fastPeriod >= slowPeriod) {
            throw new ParameterValidationException("Fast period must be less than slow period");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    @Override
    protected List<SignaledBar> computeSignals(List<PriceBar> bars) {
        double[] macd = null;
        double[] signalLine = null;
        if (usesDefaultPeriods()) {
            macd = IndicatorColumns.precomputed(bars, IndicatorColumns.MACD);
            signalLine = IndicatorColumns.precomputed(bars, IndicatorColumns.MACD_SIGNAL);
        }
        if (macd == null || signalLine == null) {
            MACD.Result computed = MACD.calculate(bars, fastPeriod, slowPeriod, signalPeriod);
            macd = computed.getMacd();
            signalLine = computed.getSignal();
        }

        if (IndicatorColumns.allNaN(signalLine)) {
            log.warn("Insufficient data for MACD({},{},{}): have {} bars. No signals generated.",
                    fastPeriod, slowPeriod, signalPeriod, bars.size());
            return allHold(bars);
        }

        List<SignaledBar> result = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            Signal signal = Signal.HOLD;
            double strength = 0;

            if (i > 0 && !Double.isNaN(macd[i]) && !Double.isNaN(signalLine[i])
                    && !Double.isNaN(macd[i - 1]) && !Double.isNaN(signalLine[i - 1])) {
                if (macd[i - 1] <= signalLine[i - 1] && macd[i] > signalLine[i]) {
                    signal = Signal.BUY;
                    strength = 1;
                    log.debug("BUY signal at {} (macd: {}, signal: {})", bars.get(i).getTimestamp(), macd[i], signalLine[i]);
                } else if (macd[i - 1] >= signalLine[i - 1] && macd[i] < signalLine[i]) {
                    signal = Signal.SELL;
                    strength = -1;
                    log.debug("SELL signal at {} (macd: {}, signal: {})", bars.get(i).getTimestamp(), macd[i], signalLine[i]);
                }
            }

            Map<String, Double> values = new LinkedHashMap<>();
            values.put(IndicatorColumns.MACD, macd[i]);
            values.put(IndicatorColumns.MACD_SIGNAL, signalLine[i]);
            result.add(SignaledBar.builder()
                    .bar(bars.get(i))
                    .signal(signal)
                    .signalStrength(strength)
                    .indicatorValues(values)
                    .build());
        }
        return result;
    }

    private boolean usesDefaultPeriods() {
        return fastPeriod == DEFAULT_FAST_PERIOD
                && slowPeriod == DEFAULT_SLOW_PERIOD
                && signalPeriod == DEFAULT_SIGNAL_PERIOD;
    }

    @Override
    public String getName() {
        return "MacdCrossover(" + fastPeriod + "," + slowPeriod + "," + signalPeriod + ")";
    }

    @Override
    public String getDescription() {
        return "Buy when MACD crosses above its signal line, sell when it crosses below";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fastPeriod", fastPeriod);
        params.put("slowPeriod", slowPeriod);
        params.put("signalPeriod", signalPeriod);
        return params;
    }
}
