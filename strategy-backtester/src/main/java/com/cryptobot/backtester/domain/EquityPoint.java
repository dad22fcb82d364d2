package com.cryptobot.backtester.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Portfolio value sampled at one bar.
 */
@Value
public class EquityPoint {
    Instant timestamp;
    BigDecimal portfolioValue;
}
