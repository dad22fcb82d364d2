package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Represents a trade execution in the ledger.
 * Price and quantity are never changed once recorded; cost adjustments produce
 * a new instance through {@link #withCosts}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Trade {

    Instant timestamp;
    String symbol;
    TradeType type;
    BigDecimal price;
    BigDecimal quantity;

    /**
     * Negative for money spent on a BUY, positive for SELL proceeds.
     */
    BigDecimal cashFlow;

    /**
     * Portfolio value right after the trade executed.
     */
    BigDecimal portfolioValue;

    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal slippage = BigDecimal.ZERO;

    public enum TradeType {
        BUY, SELL
    }

    /**
     * Notional value of the trade (price * quantity).
     */
    public BigDecimal getNotional() {
        return price.multiply(quantity);
    }

    public Trade withCosts(BigDecimal commission, BigDecimal slippage, BigDecimal adjustedPortfolioValue) {
        return toBuilder()
                .commission(commission)
                .slippage(slippage)
                .portfolioValue(adjustedPortfolioValue)
                .build();
    }
}
