package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;

import java.util.List;
import java.util.Map;

/**
 * Simple buy-and-hold strategy for benchmarking.
 * Buys on the first bar and holds until the end.
 */
public class BuyAndHoldStrategy extends AbstractStrategy {

    @Override
    protected List<SignaledBar> computeSignals(List<PriceBar> bars) {
        List<SignaledBar> result = allHold(bars);
        result.set(0, SignaledBar.builder()
                .bar(bars.get(0))
                .signal(Signal.BUY)
                .signalStrength(1)
                .build());
        return result;
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }

    @Override
    public String getDescription() {
        return "Buy on the first bar and hold until the end";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of();
    }
}
