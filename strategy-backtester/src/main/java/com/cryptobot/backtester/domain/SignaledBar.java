package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A price bar together with the signal a strategy produced for it.
 * Strength is in [-1, 1]: positive for BUY, negative for SELL, 0 for HOLD.
 */
@Value
@Builder
public class SignaledBar {

    PriceBar bar;
    Signal signal;
    double signalStrength;

    @Builder.Default
    Map<String, Double> indicatorValues = Map.of();

    public static SignaledBar hold(PriceBar bar) {
        return SignaledBar.builder()
                .bar(bar)
                .signal(Signal.HOLD)
                .signalStrength(0)
                .build();
    }

    public Instant getTimestamp() {
        return bar.getTimestamp();
    }

    public BigDecimal getClose() {
        return bar.getClose();
    }
}
