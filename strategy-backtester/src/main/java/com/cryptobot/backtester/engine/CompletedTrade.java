package com.cryptobot.backtester.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A BUY matched with the SELL that closed it.
 */
@Value
@Builder
public class CompletedTrade {
    String symbol;
    Instant entryTime;
    Instant exitTime;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal quantity;

    /**
     * (exit - entry) * quantity, before costs.
     */
    BigDecimal profit;
}
