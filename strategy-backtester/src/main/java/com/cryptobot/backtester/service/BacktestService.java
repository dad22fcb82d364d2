package com.cryptobot.backtester.service;

import com.cryptobot.backtester.controller.dto.BacktestRequest;
import com.cryptobot.backtester.controller.dto.BacktestResponse;
import com.cryptobot.backtester.controller.dto.ComparisonRequest;
import com.cryptobot.backtester.controller.dto.ComparisonResponse;
import com.cryptobot.backtester.controller.dto.RunSummaryResponse;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.StrategyComparison;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.engine.BacktestSettings;

import java.util.List;

/**
 * Service interface for running and comparing backtests.
 */
public interface BacktestService {

    /**
     * Run one strategy over the requested bars.
     *
     * @param request the backtest request
     * @return ledger, equity curve and performance of the run
     */
    BacktestResponse runBacktest(BacktestRequest request);

    /**
     * Backtest every requested strategy over the same bars.
     */
    ComparisonResponse compareStrategies(ComparisonRequest request);

    /**
     * Backtest each strategy and rank the results by total return percentage, best first.
     */
    List<StrategyComparison> compareStrategies(List<Strategy> strategies, List<PriceBar> bars,
            BacktestSettings settings);

    /**
     * Stored runs, newest first; all strategies when the name is null.
     */
    List<RunSummaryResponse> listRuns(String strategyName);
}
