package com.cryptobot.backtester.service;

import com.cryptobot.backtester.domain.strategy.BollingerBandStrategy;
import com.cryptobot.backtester.domain.strategy.BuyAndHoldStrategy;
import com.cryptobot.backtester.domain.strategy.MacdCrossoverStrategy;
import com.cryptobot.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.cryptobot.backtester.domain.strategy.MovingAverageType;
import com.cryptobot.backtester.domain.strategy.RsiMeanReversionStrategy;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.exception.ParameterValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for creating strategy instances based on name and parameters.
 * Parameter keys are matched case-insensitively and ignoring underscores,
 * so {@code fastPeriod} and {@code fast_period} are the same parameter.
 */
@Service
@Slf4j
public class StrategyFactory {

    /**
     * Create a strategy from its registered name or alias.
     *
     * @throws ParameterValidationException for unknown names or malformed parameters
     */
    public Strategy createStrategy(String strategyName, Map<String, ?> parameters) {
        return createStrategy(StrategyType.fromName(strategyName), parameters);
    }

    public Strategy createStrategy(StrategyType type, Map<String, ?> parameters) {
        log.debug("Creating strategy: {} with parameters: {}", type, parameters);
        Map<String, Object> params = normalize(parameters);

        switch (type) {
            case MA_CROSSOVER:
                return new MovingAverageCrossoverStrategy(
                        intParam(params, "fastPeriod", 10),
                        intParam(params, "slowPeriod", 20),
                        MovingAverageType.parse(stringParam(params, "maType", "SMA")));
            case RSI_MEAN_REVERSION:
                return new RsiMeanReversionStrategy(
                        intParam(params, "period", 14),
                        doubleParam(params, "oversold", 30),
                        doubleParam(params, "overbought", 70));
            case MACD_CROSSOVER:
                return new MacdCrossoverStrategy(
                        intParam(params, "fastPeriod", MacdCrossoverStrategy.DEFAULT_FAST_PERIOD),
                        intParam(params, "slowPeriod", MacdCrossoverStrategy.DEFAULT_SLOW_PERIOD),
                        intParam(params, "signalPeriod", MacdCrossoverStrategy.DEFAULT_SIGNAL_PERIOD));
            case BOLLINGER_BANDS:
                return new BollingerBandStrategy(
                        intParam(params, "period", BollingerBandStrategy.DEFAULT_PERIOD),
                        doubleParam(params, "stdDevMultiplier", BollingerBandStrategy.DEFAULT_STD_DEV_MULTIPLIER));
            case BUY_AND_HOLD:
                return new BuyAndHoldStrategy();
            default:
                throw new ParameterValidationException("Unsupported strategy type: " + type);
        }
    }

    private static Map<String, Object> normalize(Map<String, ?> parameters) {
        Map<String, Object> normalized = new HashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> normalized.put(normalizeKey(key), value));
        }
        return normalized;
    }

    private static String normalizeKey(String key) {
        return key.replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static int intParam(Map<String, Object> params, String name, int defaultValue) {
        Object value = params.get(normalizeKey(name));
        if (value == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ParameterValidationException("Parameter '" + name + "' must be an integer, got: " + value, e);
        }
    }

    private static double doubleParam(Map<String, Object> params, String name, double defaultValue) {
        Object value = params.get(normalizeKey(name));
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ParameterValidationException("Parameter '" + name + "' must be a number, got: " + value, e);
        }
    }

    private static String stringParam(Map<String, Object> params, String name, String defaultValue) {
        Object value = params.get(normalizeKey(name));
        return value == null ? defaultValue : value.toString();
    }
}
