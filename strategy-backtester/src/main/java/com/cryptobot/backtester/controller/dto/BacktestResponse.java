package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.domain.TransactionCosts;
import com.cryptobot.backtester.engine.BacktestResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for a completed backtest.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    /**
     * Id of the stored run, null unless the request asked to persist it.
     */
    private Long runId;

    private String strategyName;
    private Map<String, Object> parameters;
    private String symbol;
    private PerformanceReport performance;
    private TransactionCosts transactionCosts;
    private BigDecimal finalCash;
    private BigDecimal finalPosition;
    private List<Trade> trades;
    private List<EquityPoint> equityCurve;
    private List<SignalView> signals;

    public static BacktestResponse from(BacktestResult result, String symbol, Long runId) {
        return BacktestResponse.builder()
                .runId(runId)
                .strategyName(result.getStrategyName())
                .parameters(result.getParameters())
                .symbol(symbol)
                .performance(result.getPerformance())
                .transactionCosts(result.getTransactionCosts())
                .finalCash(result.getFinalCash())
                .finalPosition(result.getFinalPosition())
                .trades(result.getTrades())
                .equityCurve(result.getEquityCurve())
                .signals(result.getSignaledBars().stream()
                        .map(SignalView::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
