package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradePairingTest {

    @Test
    void testPairsFifoPerSymbol() {
        // Arrange
        List<Trade> trades = List.of(
                trade(0, "BTC-USD", Trade.TradeType.BUY, "100", "2"),
                trade(1, "ETH-USD", Trade.TradeType.BUY, "10", "5"),
                trade(2, "BTC-USD", Trade.TradeType.BUY, "120", "1"),
                trade(3, "BTC-USD", Trade.TradeType.SELL, "130", "2"),
                trade(4, "ETH-USD", Trade.TradeType.SELL, "8", "5"));

        // Act
        List<CompletedTrade> completed = TradePairing.pair(trades);

        // Assert
        assertEquals(2, completed.size());
        assertEquals("BTC-USD", completed.get(0).getSymbol());
        assertEquals(0, new BigDecimal("100").compareTo(completed.get(0).getEntryPrice()));
        assertEquals(0, new BigDecimal("60").compareTo(completed.get(0).getProfit()));
        assertEquals("ETH-USD", completed.get(1).getSymbol());
        assertEquals(0, new BigDecimal("-10").compareTo(completed.get(1).getProfit()));
    }

    @Test
    void testSellWithoutBuyAndOpenBuyAreIgnored() {
        List<Trade> trades = List.of(
                trade(0, "BTC-USD", Trade.TradeType.SELL, "100", "1"),
                trade(1, "BTC-USD", Trade.TradeType.BUY, "90", "1"));

        assertTrue(TradePairing.pair(trades).isEmpty());
    }

    private static Trade trade(int day, String symbol, Trade.TradeType type, String price, String quantity) {
        return Trade.builder()
                .timestamp(TestData.day(day))
                .symbol(symbol)
                .type(type)
                .price(new BigDecimal(price))
                .quantity(new BigDecimal(quantity))
                .cashFlow(BigDecimal.ZERO)
                .portfolioValue(BigDecimal.ZERO)
                .build();
    }
}
