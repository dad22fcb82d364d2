package com.cryptobot.backtester.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Volatility-scaled position: how many units to buy so that a stop
 * {@code stopDistance} away loses exactly the risk budget.
 */
@Value
@Builder
public class AtrPositionSize {
    BigDecimal units;
    BigDecimal positionValue;
    BigDecimal stopDistance;
}
