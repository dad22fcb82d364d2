package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.config.BacktestProperties;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Capital, sizing and cost inputs for a single backtest run.
 */
@Value
@Builder(toBuilder = true)
public class BacktestSettings {

    BigDecimal initialCapital;

    @Builder.Default
    BigDecimal positionSizeFraction = TradeSimulator.DEFAULT_POSITION_SIZE;

    @Builder.Default
    BigDecimal commissionRate = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal slippageRate = BigDecimal.ZERO;

    public static BacktestSettings from(BacktestProperties properties) {
        return BacktestSettings.builder()
                .initialCapital(properties.getInitialCapital())
                .positionSizeFraction(properties.getPositionSize())
                .commissionRate(properties.getCommission())
                .slippageRate(properties.getSlippage())
                .build();
    }
}
