package com.cryptobot.backtester.engine.paper;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ClosedPosition {
    String symbol;
    BigDecimal quantity;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    Instant entryTime;
    Instant exitTime;
    BigDecimal profit;
    CloseReason reason;
}
