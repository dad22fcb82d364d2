package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.engine.paper.ClosedPosition;
import com.cryptobot.backtester.engine.paper.PaperPortfolio;
import com.cryptobot.backtester.engine.paper.PaperTradingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a paper-trading session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaperTradingResponse {
    private Long runId;
    private String strategyName;
    private String symbol;
    private BigDecimal initialCapital;
    private BigDecimal finalValue;
    private BigDecimal totalReturn;
    private BigDecimal totalReturnPct;
    private BigDecimal winRate;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal totalProfit;
    private BigDecimal totalLoss;
    private List<Trade> trades;
    private List<ClosedPosition> closedPositions;
    private List<EquityPoint> equityCurve;

    public static PaperTradingResponse from(PaperTradingResult result, String symbol, Long runId) {
        PaperPortfolio portfolio = result.getPortfolio();
        return PaperTradingResponse.builder()
                .runId(runId)
                .strategyName(result.getStrategyName())
                .symbol(symbol)
                .initialCapital(portfolio.getInitialCapital())
                .finalValue(result.getFinalValue())
                .totalReturn(result.getTotalReturn())
                .totalReturnPct(result.getTotalReturnPct())
                .winRate(result.getWinRate())
                .totalTrades(portfolio.getTotalTrades())
                .winningTrades(portfolio.getWinningTrades())
                .losingTrades(portfolio.getLosingTrades())
                .totalProfit(portfolio.getTotalProfit())
                .totalLoss(portfolio.getTotalLoss())
                .trades(portfolio.getTradeHistory())
                .closedPositions(portfolio.getClosedPositions())
                .equityCurve(result.getEquityCurve())
                .build();
    }
}
