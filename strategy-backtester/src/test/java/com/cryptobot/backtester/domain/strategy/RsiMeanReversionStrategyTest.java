package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.ParameterValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RsiMeanReversionStrategyTest {

    @Test
    void testThresholdValidation() {
        assertThrows(ParameterValidationException.class, () -> new RsiMeanReversionStrategy(14, 70, 30));
        assertThrows(ParameterValidationException.class, () -> new RsiMeanReversionStrategy(14, 0, 70));
        assertThrows(ParameterValidationException.class, () -> new RsiMeanReversionStrategy(14, 30, 100));
        assertThrows(ParameterValidationException.class, () -> new RsiMeanReversionStrategy(0, 30, 70));
    }

    @Test
    void testSignalsAndStrengthFromPrecomputedRsi() {
        // Arrange
        List<PriceBar> bars = withRsi(TestData.bars(100, 90, 95, 120), Double.NaN, 20, 50, 85);
        RsiMeanReversionStrategy strategy = new RsiMeanReversionStrategy(14, 30, 70);

        // Act
        List<SignaledBar> signals = strategy.generateSignals(bars);

        // Assert
        assertEquals(Signal.HOLD, signals.get(0).getSignal());
        assertEquals(Signal.BUY, signals.get(1).getSignal());
        assertEquals(1.0 / 3.0, signals.get(1).getSignalStrength(), 1e-9);
        assertEquals(Signal.HOLD, signals.get(2).getSignal());
        assertEquals(0.0, signals.get(2).getSignalStrength());
        assertEquals(Signal.SELL, signals.get(3).getSignal());
        assertEquals(-0.5, signals.get(3).getSignalStrength(), 1e-9);
    }

    @Test
    void testThresholdsAreInclusive() {
        List<PriceBar> bars = withRsi(TestData.bars(1, 2), 30, 70);
        RsiMeanReversionStrategy strategy = new RsiMeanReversionStrategy(14, 30, 70);

        List<SignaledBar> signals = strategy.generateSignals(bars);

        assertEquals(Signal.BUY, signals.get(0).getSignal());
        assertEquals(0.0, signals.get(0).getSignalStrength());
        assertEquals(Signal.SELL, signals.get(1).getSignal());
    }

    @Test
    void testComputedRsi_SteadyDeclineIsOversold() {
        RsiMeanReversionStrategy strategy = new RsiMeanReversionStrategy(3, 30, 70);

        List<SignaledBar> signals = strategy.generateSignals(TestData.bars(10, 9, 8, 7, 6));

        assertEquals(Signal.HOLD, signals.get(2).getSignal());
        assertEquals(Signal.BUY, signals.get(3).getSignal());
        assertEquals(1.0, signals.get(3).getSignalStrength(), 1e-9);
    }

    @Test
    void testSeriesTooShort_AllHold() {
        RsiMeanReversionStrategy strategy = new RsiMeanReversionStrategy(14, 30, 70);

        List<SignaledBar> signals = strategy.generateSignals(TestData.bars(1, 2, 3));

        assertTrue(signals.stream().allMatch(s -> s.getSignal() == Signal.HOLD));
    }

    private static List<PriceBar> withRsi(List<PriceBar> bars, double... rsi) {
        List<PriceBar> result = new ArrayList<>();
        for (int i = 0; i < bars.size(); i++) {
            result.add(bars.get(i).toBuilder().indicators(Map.of("rsi", rsi[i])).build());
        }
        return result;
    }
}
