package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.InvalidDataException;
import com.cryptobot.backtester.exception.ParameterValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MovingAverageCrossoverStrategy.
 */
class MovingAverageCrossoverStrategyTest {

    @Test
    void testConstructorThrowsExceptionWhenFastPeriodGreaterOrEqualToSlowPeriod() {
        assertThrows(ParameterValidationException.class, () -> new MovingAverageCrossoverStrategy(50, 50));

        assertThrows(ParameterValidationException.class, () -> new MovingAverageCrossoverStrategy(100, 50));
    }

    @Test
    void testConstructorRejectsNonPositiveFastPeriod() {
        assertThrows(ParameterValidationException.class, () -> new MovingAverageCrossoverStrategy(0, 5));
    }

    @Test
    void testConstructorAcceptsValidPeriods() {
        assertDoesNotThrow(() -> new MovingAverageCrossoverStrategy(10, 20));
        assertDoesNotThrow(() -> new MovingAverageCrossoverStrategy(1, 2, MovingAverageType.EMA));
    }

    @Test
    void testGoldenCrossBuyAndDeathCrossSell() {
        // Arrange
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);
        List<PriceBar> bars = TestData.bars(3, 2, 1, 2, 3, 4, 3, 2, 1);

        // Act
        List<SignaledBar> signals = strategy.generateSignals(bars);

        // Assert
        assertEquals(bars.size(), signals.size());
        assertEquals(List.of(Signal.HOLD, Signal.HOLD, Signal.HOLD, Signal.HOLD, Signal.BUY,
                Signal.HOLD, Signal.HOLD, Signal.SELL, Signal.HOLD), signalsOf(signals));
        assertEquals(1.0, signals.get(4).getSignalStrength());
        assertEquals(-1.0, signals.get(7).getSignalStrength());
    }

    @Test
    void testFirstBarIsAlwaysHold() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);

        List<SignaledBar> signals = strategy.generateSignals(TestData.bars(3, 2, 1, 2, 3));

        assertEquals(Signal.HOLD, signals.get(0).getSignal());
    }

    @Test
    void testEqualAveragesCountAsNotYetCrossed() {
        // Arrange - precomputed columns: equal at index 1, fast above at index 2
        List<PriceBar> bars = withColumns(TestData.bars(1, 2, 3),
                "sma_2", new double[] { 1, 2, 3 },
                "sma_3", new double[] { 1, 2, 2 });
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);

        // Act
        List<SignaledBar> signals = strategy.generateSignals(bars);

        // Assert
        assertEquals(List.of(Signal.HOLD, Signal.HOLD, Signal.BUY), signalsOf(signals));
    }

    @Test
    void testNaNAtPreviousBarGivesHold() {
        List<PriceBar> bars = withColumns(TestData.bars(1, 2, 3),
                "ema_2", new double[] { Double.NaN, 1, 3 },
                "ema_3", new double[] { Double.NaN, Double.NaN, 2 });
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3, MovingAverageType.EMA);

        List<SignaledBar> signals = strategy.generateSignals(bars);

        assertEquals(List.of(Signal.HOLD, Signal.HOLD, Signal.HOLD), signalsOf(signals));
    }

    @Test
    void testSeriesTooShortForSlowWindow_AllHold() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(5, 10);

        List<SignaledBar> signals = strategy.generateSignals(TestData.bars(1, 2, 3, 4, 5, 6, 7, 8, 9));

        assertEquals(9, signals.size());
        assertTrue(signals.stream().allMatch(s -> s.getSignal() == Signal.HOLD));
    }

    @Test
    void testEmptySeries_EmptyResult() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);

        assertTrue(strategy.generateSignals(new ArrayList<>()).isEmpty());
    }

    @Test
    void testNullSeries_Throws() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);

        assertThrows(InvalidDataException.class, () -> strategy.generateSignals(null));
    }

    @Test
    void testBarWithoutClose_Throws() {
        // Arrange
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);
        List<PriceBar> bars = TestData.bars(1, 2, 3);
        bars.set(1, bars.get(1).toBuilder().close(null).build());

        // Act & Assert
        InvalidDataException exception = assertThrows(InvalidDataException.class,
                () -> strategy.generateSignals(bars));
        assertTrue(exception.getMessage().contains("close"));
        assertEquals("invalid_data", exception.getCode());
    }

    @Test
    void testBarWithoutTimestamp_Throws() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);
        List<PriceBar> bars = TestData.bars(1, 2, 3);
        bars.set(0, bars.get(0).toBuilder().timestamp(null).build());

        assertThrows(InvalidDataException.class, () -> strategy.generateSignals(bars));
    }

    @Test
    void testNameAndParameters() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(10, 20);

        assertEquals("MovingAverageCrossover(SMA,10,20)", strategy.getName());
        assertEquals(10, strategy.getParameters().get("fastPeriod"));
        assertEquals(20, strategy.getParameters().get("slowPeriod"));
        assertEquals("SMA", strategy.getParameters().get("maType"));
    }

    @Test
    void testSignalsCarryIndicatorValues() {
        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(2, 3);

        List<SignaledBar> signals = strategy.generateSignals(TestData.bars(3, 2, 1));

        assertEquals(1.5, signals.get(2).getIndicatorValues().get("sma_2"), 1e-9);
        assertEquals(2.0, signals.get(2).getIndicatorValues().get("sma_3"), 1e-9);
    }

    static List<Signal> signalsOf(List<SignaledBar> signals) {
        return signals.stream().map(SignaledBar::getSignal).collect(Collectors.toList());
    }

    static List<PriceBar> withColumns(List<PriceBar> bars, String firstColumn, double[] first,
            String secondColumn, double[] second) {
        List<PriceBar> result = new ArrayList<>();
        for (int i = 0; i < bars.size(); i++) {
            result.add(bars.get(i).toBuilder()
                    .indicators(Map.of(firstColumn, first[i], secondColumn, second[i]))
                    .build());
        }
        return result;
    }
}
