package com.cryptobot.backtester.engine.paper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * An open paper position. Value and unrealized P&L are refreshed on every bar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    private Instant entryTime;

    /**
     * Null when the position has no stop.
     */
    private BigDecimal stopLoss;

    private BigDecimal takeProfit;

    private BigDecimal currentValue;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal unrealizedPnlPct = BigDecimal.ZERO;

    public BigDecimal getCostBasis() {
        return quantity.multiply(entryPrice);
    }

    void markToMarket(BigDecimal price, int scale) {
        BigDecimal costBasis = getCostBasis();
        currentValue = quantity.multiply(price);
        unrealizedPnl = currentValue.subtract(costBasis);
        unrealizedPnlPct = costBasis.signum() == 0
                ? BigDecimal.ZERO
                : unrealizedPnl.multiply(BigDecimal.valueOf(100)).divide(costBasis, scale, RoundingMode.HALF_UP);
    }
}
