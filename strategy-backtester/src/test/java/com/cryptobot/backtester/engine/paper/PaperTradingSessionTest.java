package com.cryptobot.backtester.engine.paper;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.risk.PortfolioRiskCalculator;
import com.cryptobot.backtester.risk.PositionSizer;
import com.cryptobot.backtester.risk.RiskCalculator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.cryptobot.backtester.domain.Signal.BUY;
import static com.cryptobot.backtester.domain.Signal.HOLD;
import static com.cryptobot.backtester.domain.Signal.SELL;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaperTradingSession exit ordering and session close.
 */
class PaperTradingSessionTest {

    private static final BigDecimal CAPITAL = new BigDecimal("1000");

    private final PaperTradingSettings settings = PaperTradingSettings.builder()
            .initialCapital(CAPITAL)
            .build();

    @Test
    void testStopLossTakesPrecedenceOverSellSignal() {
        // Arrange - stop at 98, second bar closes at 97 with a SELL signal
        List<PriceBar> bars = TestData.bars(100, 97);

        // Act
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(BUY, SELL), bars);

        // Assert
        List<ClosedPosition> closed = result.getPortfolio().getClosedPositions();
        assertEquals(1, closed.size());
        assertEquals(CloseReason.STOP_LOSS, closed.get(0).getReason());
        assertEquals(0, new BigDecimal("971.5").compareTo(result.getFinalValue()));
        assertEquals(0, new BigDecimal("-2.85").compareTo(result.getTotalReturnPct()));
    }

    @Test
    void testTakeProfit() {
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(BUY, HOLD),
                TestData.bars(100, 106));

        assertEquals(CloseReason.TAKE_PROFIT, result.getPortfolio().getClosedPositions().get(0).getReason());
    }

    @Test
    void testSellSignalClosesPosition() {
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(BUY, HOLD, SELL),
                TestData.bars(100, 101, 102));

        ClosedPosition closed = result.getPortfolio().getClosedPositions().get(0);
        assertEquals(CloseReason.SIGNAL, closed.getReason());
        assertEquals(0, new BigDecimal("19").compareTo(closed.getProfit()));
    }

    @Test
    void testOpenPositionForceClosedAtEndOfSession() {
        // Act
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(BUY, HOLD),
                TestData.bars(100, 101));

        // Assert
        PaperPortfolio portfolio = result.getPortfolio();
        assertTrue(portfolio.getPositions().isEmpty());
        assertEquals(CloseReason.END_OF_SESSION, portfolio.getClosedPositions().get(0).getReason());
        assertEquals(0, new BigDecimal("1009.5").compareTo(result.getFinalValue()));
        assertEquals(0, result.getFinalValue().compareTo(portfolio.getCash()));
        assertEquals(2, portfolio.getTotalTrades());
        assertEquals(1, portfolio.getWinningTrades());
        assertEquals(new BigDecimal("50.0000"), result.getWinRate());
    }

    @Test
    void testEquityCurveMarkedToMarketEveryBar() {
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(BUY, HOLD, HOLD),
                TestData.bars(100, 102, 101));

        assertEquals(3, result.getEquityCurve().size());
        assertEquals(0, new BigDecimal("1000").compareTo(result.getEquityCurve().get(0).getPortfolioValue()));
        assertEquals(0, new BigDecimal("1019").compareTo(result.getEquityCurve().get(1).getPortfolioValue()));
        assertEquals(0, new BigDecimal("1009.5").compareTo(result.getEquityCurve().get(2).getPortfolioValue()));
    }

    @Test
    void testTrailingStopRatchetsAndTriggers() {
        // Arrange - take-profit out of reach so only the trailing stop can exit
        PaperTradingSettings trailing = settings.toBuilder()
                .takeProfitPct(BigDecimal.ONE)
                .trailingStopPct(new BigDecimal("0.05"))
                .build();

        // Act
        PaperTradingResult result = new PaperTradingSession(trailing).run(TestData.scripted(BUY, HOLD, HOLD),
                TestData.bars(100, 120, 113));

        // Assert
        ClosedPosition closed = result.getPortfolio().getClosedPositions().get(0);
        assertEquals(CloseReason.STOP_LOSS, closed.getReason());
        assertEquals(0, new BigDecimal("113").compareTo(closed.getExitPrice()));
    }

    @Test
    void testNoSignals_NoTrades() {
        PaperTradingResult result = new PaperTradingSession(settings).run(TestData.scripted(HOLD, HOLD),
                TestData.bars(100, 101));

        assertTrue(result.getPortfolio().getTradeHistory().isEmpty());
        assertEquals(0, CAPITAL.compareTo(result.getFinalValue()));
        assertEquals(0, result.getWinRate().signum());
    }

    @Test
    void testEntryShrunkToPortfolioRiskBudget() {
        // Arrange - a 50 % stop on 950 notional risks 475, the 10 % budget allows 100
        PaperTradingSettings wideStop = settings.toBuilder()
                .stopLossPct(new BigDecimal("0.5"))
                .takeProfitPct(BigDecimal.ONE)
                .build();
        PaperTradingSession session = new PaperTradingSession(wideStop, new RiskCalculator(), new PositionSizer(),
                new PortfolioRiskCalculator(10, new BigDecimal("0.10")), 10);

        // Act
        PaperTradingResult result = session.run(TestData.scripted(BUY, HOLD), TestData.bars(100, 101));

        // Assert
        ClosedPosition closed = result.getPortfolio().getClosedPositions().get(0);
        assertEquals(0, new BigDecimal("2").compareTo(closed.getQuantity()));
        assertEquals(0, new BigDecimal("1002").compareTo(result.getFinalValue()));
    }

    @Test
    void testEntryWithinRiskBudget_Unchanged() {
        PaperTradingSession session = new PaperTradingSession(settings, new RiskCalculator(), new PositionSizer(),
                new PortfolioRiskCalculator(10, new BigDecimal("0.10")), 10);

        PaperTradingResult result = session.run(TestData.scripted(BUY, HOLD), TestData.bars(100, 101));

        assertEquals(0, new BigDecimal("9.5").compareTo(result.getPortfolio().getClosedPositions().get(0).getQuantity()));
    }

    @Test
    void testKellySizing_UsesClosedPositionHistory() {
        // Arrange - a 2 win, then a 0.2004 loss, then a Kelly-sized entry
        PaperTradingSettings kelly = settings.toBuilder()
                .sizingMethod(SizingMethod.KELLY)
                .build();

        // Act
        PaperTradingResult result = new PaperTradingSession(kelly).run(
                TestData.scripted(BUY, HOLD, BUY, SELL, BUY, HOLD),
                TestData.bars(100, 110, 100, 99, 100, 101));

        // Assert
        List<ClosedPosition> closed = result.getPortfolio().getClosedPositions();
        assertEquals(3, closed.size());
        // no history yet: 2 % fallback of cash
        assertEquals(0, new BigDecimal("0.2").compareTo(closed.get(0).getQuantity()));
        assertEquals(CloseReason.TAKE_PROFIT, closed.get(0).getReason());
        // wins only: still no average loss
        assertEquals(0, new BigDecimal("0.2004").compareTo(closed.get(1).getQuantity()));
        // f = 0.5 - 0.5 * 0.2004 / 2 = 0.4499 of 1001.7996
        assertEquals(4.507096, closed.get(2).getQuantity().doubleValue(), 0.0001);
    }
}
