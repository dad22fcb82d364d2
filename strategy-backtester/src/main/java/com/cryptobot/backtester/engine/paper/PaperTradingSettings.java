package com.cryptobot.backtester.engine.paper;

import com.cryptobot.backtester.config.BacktestProperties;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class PaperTradingSettings {

    BigDecimal initialCapital;

    @Builder.Default
    BigDecimal positionSizeFraction = new BigDecimal("0.95");

    @Builder.Default
    BigDecimal stopLossPct = new BigDecimal("0.02");

    @Builder.Default
    BigDecimal takeProfitPct = new BigDecimal("0.05");

    @Builder.Default
    SizingMethod sizingMethod = SizingMethod.FIXED_FRACTION;

    /**
     * Trailing distance for the stop; null keeps the stop fixed at its entry level.
     */
    BigDecimal trailingStopPct;

    public static PaperTradingSettings from(BacktestProperties properties) {
        return PaperTradingSettings.builder()
                .initialCapital(properties.getInitialCapital())
                .positionSizeFraction(properties.getPositionSize())
                .stopLossPct(properties.getStopLossPct())
                .takeProfitPct(properties.getTakeProfitPct())
                .build();
    }
}
