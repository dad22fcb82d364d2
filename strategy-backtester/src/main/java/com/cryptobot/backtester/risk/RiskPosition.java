package com.cryptobot.backtester.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An open or proposed position as seen by the portfolio risk checks.
 */
@Value
@Builder
public class RiskPosition {
    String symbol;
    BigDecimal positionValue;

    /**
     * Amount lost if the position's stop is hit.
     */
    BigDecimal riskAmount;
}
