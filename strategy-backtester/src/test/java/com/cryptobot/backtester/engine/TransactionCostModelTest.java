package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.domain.TransactionCosts;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCostModelTest {

    private final TransactionCostModel costModel =
            new TransactionCostModel(new BigDecimal("0.001"), new BigDecimal("0.0005"));

    @Test
    void testCostsOnRoundTrip() {
        // Arrange
        SimulationResult simulation = roundTrip();

        // Act
        SimulationResult costed = costModel.apply(simulation);

        // Assert
        TransactionCosts costs = costed.getTransactionCosts();
        assertEquals(0, new BigDecimal("1.805").compareTo(costs.getTotalCommission()));
        assertEquals(0, new BigDecimal("0.9025").compareTo(costs.getTotalSlippage()));
        assertEquals(0, new BigDecimal("2.7075").compareTo(costs.getTotalCosts()));
        assertEquals(0, new BigDecimal("902.2925").compareTo(costed.getFinalValue()));
    }

    @Test
    void testPortfolioValuesReducedByOwnTradeCosts() {
        SimulationResult costed = costModel.apply(roundTrip());

        Trade buy = costed.getTrades().get(0);
        Trade sell = costed.getTrades().get(1);
        assertEquals(0, new BigDecimal("0.95").compareTo(buy.getCommission()));
        assertEquals(0, new BigDecimal("0.475").compareTo(buy.getSlippage()));
        assertEquals(0, new BigDecimal("998.575").compareTo(buy.getPortfolioValue()));
        assertEquals(0, new BigDecimal("903.7175").compareTo(sell.getPortfolioValue()));
        assertEquals(0, new BigDecimal("902.2925").compareTo(costed.getFinalValue()));
    }

    @Test
    void testOriginalTradesAreNotModified() {
        SimulationResult simulation = roundTrip();
        Trade original = simulation.getTrades().get(0);

        SimulationResult costed = costModel.apply(simulation);

        assertNotSame(original, costed.getTrades().get(0));
        assertEquals(0, BigDecimal.ZERO.compareTo(original.getCommission()));
        assertEquals(0, new BigDecimal("1000").compareTo(original.getPortfolioValue()));
        assertEquals(original.getPrice(), costed.getTrades().get(0).getPrice());
        assertEquals(original.getQuantity(), costed.getTrades().get(0).getQuantity());
        // Cash is reported before costs
        assertEquals(simulation.getFinalCash(), costed.getFinalCash());
    }

    @Test
    void testNoTrades_ZeroCosts() {
        SimulationResult simulation = SimulationResult.builder()
                .trades(List.of())
                .finalCash(new BigDecimal("1000"))
                .finalPosition(BigDecimal.ZERO)
                .finalValue(new BigDecimal("1000"))
                .build();

        SimulationResult costed = costModel.apply(simulation);

        assertEquals(TransactionCosts.NONE, costed.getTransactionCosts());
        assertEquals(0, new BigDecimal("1000").compareTo(costed.getFinalValue()));
    }

    private static SimulationResult roundTrip() {
        Trade buy = Trade.builder()
                .timestamp(TestData.day(0))
                .symbol(TestData.SYMBOL)
                .type(Trade.TradeType.BUY)
                .price(new BigDecimal("100"))
                .quantity(new BigDecimal("9.5"))
                .cashFlow(new BigDecimal("-950"))
                .portfolioValue(new BigDecimal("1000"))
                .build();
        Trade sell = Trade.builder()
                .timestamp(TestData.day(2))
                .symbol(TestData.SYMBOL)
                .type(Trade.TradeType.SELL)
                .price(new BigDecimal("90"))
                .quantity(new BigDecimal("9.5"))
                .cashFlow(new BigDecimal("855"))
                .portfolioValue(new BigDecimal("905"))
                .build();
        return SimulationResult.builder()
                .trades(List.of(buy, sell))
                .finalCash(new BigDecimal("905"))
                .finalPosition(BigDecimal.ZERO)
                .finalValue(new BigDecimal("905"))
                .build();
    }
}
