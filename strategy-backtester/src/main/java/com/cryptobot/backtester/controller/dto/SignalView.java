package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Per-bar signal as returned to clients, with the indicator values behind it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalView {
    private Instant timestamp;
    private BigDecimal close;
    private Signal signal;
    private double signalStrength;
    private Map<String, Double> indicators;

    public static SignalView from(SignaledBar bar) {
        return SignalView.builder()
                .timestamp(bar.getTimestamp())
                .close(bar.getClose())
                .signal(bar.getSignal())
                .signalStrength(bar.getSignalStrength())
                .indicators(bar.getIndicatorValues())
                .build();
    }
}
