package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.domain.TransactionCosts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of a backtest run.
 */
@Value
@Builder
public class BacktestResult {
    String strategyName;
    Map<String, Object> parameters;
    List<SignaledBar> signaledBars;
    List<Trade> trades;
    List<EquityPoint> equityCurve;
    PerformanceReport performance;
    TransactionCosts transactionCosts;
    BigDecimal finalCash;
    BigDecimal finalPosition;
}
