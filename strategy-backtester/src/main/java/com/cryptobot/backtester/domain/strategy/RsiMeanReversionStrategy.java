package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.ParameterValidationException;
import com.cryptobot.backtester.indicators.IndicatorColumns;
import com.cryptobot.backtester.indicators.RSI;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RSI mean reversion: buy when RSI is oversold, sell when it is overbought.
 * Signal strength grows the deeper RSI sits inside the threshold zone.
 */
@Slf4j
@Getter
public class RsiMeanReversionStrategy extends AbstractStrategy {

    private final int period;
    private final double oversold;
    private final double overbought;

    public RsiMeanReversionStrategy(int period, double oversold, double overbought) {
        if (period <= 0) {
            throw new ParameterValidationException("RSI period must be positive");
        }
        if (!(oversold > 0 && oversold < overbought && overbought < 100)) {
            throw new ParameterValidationException(
                    "RSI thresholds must satisfy 0 < oversold < overbought < 100, got "
                            + oversold + " / " + overbought);
        }
        this.period = period;
        this.oversold = oversold;
        this.overbought = overbought;
    }

    @Override
    protected List<SignaledBar> computeSignals(List<PriceBar> bars) {
        double[] rsi = IndicatorColumns.precomputed(bars, IndicatorColumns.RSI);
        if (rsi == null) {
            rsi = RSI.calculate(bars, period);
        }

        if (IndicatorColumns.allNaN(rsi)) {
            log.warn("Insufficient data for RSI({}): need more than {} bars, have {}. No signals generated.",
                    period, period, bars.size());
            return allHold(bars);
        }

        List<SignaledBar> result = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            double value = rsi[i];
            Signal signal = Signal.HOLD;
            double strength = 0;

            if (!Double.isNaN(value)) {
                if (value <= oversold) {
                    signal = Signal.BUY;
                    strength = (oversold - value) / oversold;
                    log.debug("BUY signal at {} RSI: {}", bars.get(i).getTimestamp(), value);
                } else if (value >= overbought) {
                    signal = Signal.SELL;
                    strength = -(value - overbought) / (100 - overbought);
                    log.debug("SELL signal at {} RSI: {}", bars.get(i).getTimestamp(), value);
                }
            }

            result.add(SignaledBar.builder()
                    .bar(bars.get(i))
                    .signal(signal)
                    .signalStrength(strength)
                    .indicatorValues(Map.of(IndicatorColumns.RSI, value))
                    .build());
        }
        return result;
    }

    @Override
    public String getName() {
        return "RsiMeanReversion(" + period + "," + oversold + "," + overbought + ")";
    }

    @Override
    public String getDescription() {
        return "Buy when RSI <= " + oversold + ", sell when RSI >= " + overbought;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("period", period);
        params.put("oversold", oversold);
        params.put("overbought", overbought);
        return params;
    }
}
