package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.exception.InvalidDataException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared input validation and bookkeeping for the built-in strategies.
 */
@Slf4j
public abstract class AbstractStrategy implements Strategy {

    @Override
    public final List<SignaledBar> generateSignals(List<PriceBar> bars) {
        validateData(bars);
        if (bars.isEmpty()) {
            return List.of();
        }

        List<SignaledBar> signals = computeSignals(bars);

        long buys = signals.stream().filter(s -> s.getSignal() == Signal.BUY).count();
        long sells = signals.stream().filter(s -> s.getSignal() == Signal.SELL).count();
        log.info("{}: generated {} BUY and {} SELL signals over {} bars", getName(), buys, sells, bars.size());

        return Collections.unmodifiableList(signals);
    }

    /**
     * Compute the signals for a validated, non-empty series.
     */
    protected abstract List<SignaledBar> computeSignals(List<PriceBar> bars);

    protected static List<SignaledBar> allHold(List<PriceBar> bars) {
        List<SignaledBar> result = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            result.add(SignaledBar.hold(bar));
        }
        return result;
    }

    /**
     * Every bar must carry a timestamp and a positive close price.
     */
    protected static void validateData(List<PriceBar> bars) {
        if (bars == null) {
            throw new InvalidDataException("Price series is required");
        }
        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            if (bar == null) {
                throw new InvalidDataException("Bar " + i + " is null");
            }
            if (bar.getTimestamp() == null) {
                throw new InvalidDataException("Bar " + i + " is missing required field 'timestamp'");
            }
            if (bar.getClose() == null) {
                throw new InvalidDataException("Bar " + i + " is missing required field 'close'");
            }
            if (bar.getClose().signum() <= 0) {
                throw new InvalidDataException("Bar " + i + " has non-positive close " + bar.getClose());
            }
        }
    }

    @Override
    public String toString() {
        return getName() + getParameters();
    }
}
