package com.cryptobot.backtester.engine.paper;

import com.cryptobot.backtester.domain.Trade;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cash, open positions and trade history of a paper-trading account.
 * Orders that cannot be filled are logged and ignored; cash never goes negative.
 */
@Slf4j
@Getter
public class PaperPortfolio {

    private final BigDecimal initialCapital;
    private final int scale;
    private BigDecimal cash;

    @Getter(AccessLevel.NONE)
    private final Map<String, Position> positions = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<Trade> tradeHistory = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<ClosedPosition> closedPositions = new ArrayList<>();

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal totalProfit = BigDecimal.ZERO;
    private BigDecimal totalLoss = BigDecimal.ZERO;

    public PaperPortfolio(BigDecimal initialCapital, int scale) {
        this.initialCapital = initialCapital;
        this.scale = scale;
        this.cash = initialCapital;
        log.info("Paper portfolio created with ${}", initialCapital);
    }

    public PaperPortfolio(BigDecimal initialCapital) {
        this(initialCapital, 10);
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public List<Trade> getTradeHistory() {
        return Collections.unmodifiableList(tradeHistory);
    }

    public List<ClosedPosition> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public boolean hasPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    /**
     * Cash plus the value of open positions, each marked at {@code prices} or at its last known value.
     */
    public BigDecimal getPortfolioValue(Map<String, BigDecimal> prices) {
        BigDecimal positionValue = BigDecimal.ZERO;
        for (Position position : positions.values()) {
            BigDecimal price = prices.get(position.getSymbol());
            positionValue = positionValue.add(price != null
                    ? position.getQuantity().multiply(price)
                    : position.getCurrentValue());
        }
        return cash.add(positionValue);
    }

    public BigDecimal getPortfolioValue(String symbol, BigDecimal price) {
        return getPortfolioValue(Map.of(symbol, price));
    }

    /**
     * Buy {@code quantity} units at {@code price}.
     *
     * @return false if cash is insufficient or a position for the symbol is already open
     */
    public boolean openPosition(String symbol, BigDecimal quantity, BigDecimal price,
            BigDecimal stopLoss, BigDecimal takeProfit, Instant time) {
        BigDecimal cost = quantity.multiply(price);

        if (cost.compareTo(cash) > 0) {
            log.warn("Insufficient cash for {} trade. Need: {} Have: {}", symbol, cost, cash);
            return false;
        }
        if (positions.containsKey(symbol)) {
            log.warn("Position already open for {}", symbol);
            return false;
        }

        positions.put(symbol, Position.builder()
                .symbol(symbol)
                .quantity(quantity)
                .entryPrice(price)
                .entryTime(time)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .currentValue(cost)
                .build());
        cash = cash.subtract(cost);

        tradeHistory.add(Trade.builder()
                .timestamp(time)
                .symbol(symbol)
                .type(Trade.TradeType.BUY)
                .price(price)
                .quantity(quantity)
                .cashFlow(cost.negate())
                .portfolioValue(cash.add(cost))
                .build());
        totalTrades++;

        log.info("OPENED position: {} {} units @ {} Cost: {}", symbol, quantity, price, cost);
        return true;
    }

    /**
     * Sell the whole position at {@code price}. A zero-profit close counts as a loss.
     *
     * @return false if no position is open for the symbol
     */
    public boolean closePosition(String symbol, BigDecimal price, CloseReason reason, Instant time) {
        Position position = positions.remove(symbol);
        if (position == null) {
            log.warn("No open position for {}", symbol);
            return false;
        }

        BigDecimal proceeds = position.getQuantity().multiply(price);
        BigDecimal profit = proceeds.subtract(position.getCostBasis());
        cash = cash.add(proceeds);

        tradeHistory.add(Trade.builder()
                .timestamp(time)
                .symbol(symbol)
                .type(Trade.TradeType.SELL)
                .price(price)
                .quantity(position.getQuantity())
                .cashFlow(proceeds)
                .portfolioValue(getPortfolioValue(symbol, price))
                .build());
        closedPositions.add(ClosedPosition.builder()
                .symbol(symbol)
                .quantity(position.getQuantity())
                .entryPrice(position.getEntryPrice())
                .exitPrice(price)
                .entryTime(position.getEntryTime())
                .exitTime(time)
                .profit(profit)
                .reason(reason)
                .build());

        totalTrades++;
        if (profit.signum() > 0) {
            winningTrades++;
            totalProfit = totalProfit.add(profit);
        } else {
            losingTrades++;
            totalLoss = totalLoss.add(profit.abs());
        }

        log.info("CLOSED position: {} @ {} P/L: {} Reason: {}",
                symbol, price, profit.setScale(2, RoundingMode.HALF_UP), reason);
        return true;
    }

    /**
     * Refresh value and unrealized P&L of the open position, if any.
     */
    public void markToMarket(String symbol, BigDecimal price) {
        Position position = positions.get(symbol);
        if (position != null) {
            position.markToMarket(price, scale);
        }
    }

    /**
     * Win rate over all recorded trades, opens included, in percent.
     */
    public BigDecimal getWinRate() {
        if (totalTrades == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winningTrades)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalTrades), 4, RoundingMode.HALF_UP);
    }
}
