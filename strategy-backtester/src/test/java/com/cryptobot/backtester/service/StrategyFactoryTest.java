package com.cryptobot.backtester.service;

import com.cryptobot.backtester.domain.strategy.BollingerBandStrategy;
import com.cryptobot.backtester.domain.strategy.BuyAndHoldStrategy;
import com.cryptobot.backtester.domain.strategy.MacdCrossoverStrategy;
import com.cryptobot.backtester.domain.strategy.MovingAverageCrossoverStrategy;
import com.cryptobot.backtester.domain.strategy.MovingAverageType;
import com.cryptobot.backtester.domain.strategy.RsiMeanReversionStrategy;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.exception.ParameterValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StrategyFactoryTest {

    private final StrategyFactory factory = new StrategyFactory();

    @Test
    void testCreateMovingAverage_SnakeCaseKeys() {
        Strategy strategy = factory.createStrategy("ma_crossover",
                Map.of("fast_period", 5, "slow_period", 15, "ma_type", "ema"));

        MovingAverageCrossoverStrategy ma = assertInstanceOf(MovingAverageCrossoverStrategy.class, strategy);
        assertEquals(5, ma.getFastPeriod());
        assertEquals(15, ma.getSlowPeriod());
        assertEquals(MovingAverageType.EMA, ma.getMaType());
    }

    @Test
    void testCreateMovingAverage_Defaults() {
        MovingAverageCrossoverStrategy ma = (MovingAverageCrossoverStrategy)
                factory.createStrategy("MA_CROSSOVER", null);

        assertEquals(10, ma.getFastPeriod());
        assertEquals(20, ma.getSlowPeriod());
        assertEquals(MovingAverageType.SMA, ma.getMaType());
    }

    @Test
    void testCreateRsi_StringValues() {
        RsiMeanReversionStrategy rsi = (RsiMeanReversionStrategy)
                factory.createStrategy("rsi", Map.of("period", "10", "oversold", "25", "overbought", 75.5));

        assertEquals(10, rsi.getPeriod());
        assertEquals(25.0, rsi.getOversold());
        assertEquals(75.5, rsi.getOverbought());
    }

    @Test
    void testCreateOtherStrategies_Defaults() {
        MacdCrossoverStrategy macd = (MacdCrossoverStrategy) factory.createStrategy("macd", Map.of());
        assertEquals(12, macd.getFastPeriod());
        assertEquals(26, macd.getSlowPeriod());
        assertEquals(9, macd.getSignalPeriod());

        BollingerBandStrategy bb = (BollingerBandStrategy) factory.createStrategy("bollinger", Map.of());
        assertEquals(20, bb.getPeriod());
        assertEquals(2.0, bb.getStdDevMultiplier());

        assertInstanceOf(BuyAndHoldStrategy.class, factory.createStrategy("buy_and_hold", Map.of()));
    }

    @Test
    void testFractionalPeriod_Rejected() {
        assertThrows(ParameterValidationException.class,
                () -> factory.createStrategy("rsi", Map.of("period", "5.5")));
    }

    @Test
    void testNonNumericParameter_Rejected() {
        assertThrows(ParameterValidationException.class,
                () -> factory.createStrategy("bollinger", Map.of("stdDevMultiplier", "wide")));
    }

    @Test
    void testUnknownStrategy_Rejected() {
        ParameterValidationException exception = assertThrows(ParameterValidationException.class,
                () -> factory.createStrategy("turtle", Map.of()));

        assertTrue(exception.getMessage().contains("turtle"));
        assertEquals("invalid_parameters", exception.getCode());
    }

    @Test
    void testInvalidCombination_Rejected() {
        assertThrows(ParameterValidationException.class,
                () -> factory.createStrategy("ma_crossover", Map.of("fastPeriod", 30, "slowPeriod", 20)));
    }
}
