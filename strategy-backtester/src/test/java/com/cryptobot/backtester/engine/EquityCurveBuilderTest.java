package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquityCurveBuilderTest {

    @Test
    void testStepFunctionFollowsTrades() {
        // Arrange
        List<PriceBar> bars = TestData.bars(100, 110, 90, 120);
        List<Trade> trades = List.of(
                trade(1, Trade.TradeType.BUY, "1000"),
                trade(2, Trade.TradeType.SELL, "905"));

        // Act
        List<EquityPoint> curve = EquityCurveBuilder.build(bars, trades, new BigDecimal("1000"));

        // Assert
        assertEquals(4, curve.size());
        assertEquals(List.of(new BigDecimal("1000"), new BigDecimal("1000"), new BigDecimal("905"),
                new BigDecimal("905")), EquityCurveBuilder.values(curve));
        assertEquals(TestData.day(3), curve.get(3).getTimestamp());
    }

    @Test
    void testNoTrades_FlatAtInitialCapital() {
        List<EquityPoint> curve = EquityCurveBuilder.build(TestData.bars(1, 2, 3), List.of(), new BigDecimal("500"));

        assertEquals(3, curve.size());
        assertTrue(curve.stream().allMatch(p -> p.getPortfolioValue().compareTo(new BigDecimal("500")) == 0));
    }

    private static Trade trade(int day, Trade.TradeType type, String portfolioValue) {
        return Trade.builder()
                .timestamp(TestData.day(day))
                .symbol(TestData.SYMBOL)
                .type(type)
                .price(BigDecimal.ONE)
                .quantity(BigDecimal.ONE)
                .cashFlow(BigDecimal.ONE)
                .portfolioValue(new BigDecimal(portfolioValue))
                .build();
    }
}
