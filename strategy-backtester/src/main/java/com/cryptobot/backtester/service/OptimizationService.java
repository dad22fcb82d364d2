package com.cryptobot.backtester.service;

import com.cryptobot.backtester.config.BacktestProperties;
import com.cryptobot.backtester.controller.dto.OptimizationRequest;
import com.cryptobot.backtester.controller.dto.OptimizationResponse;
import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.engine.BacktestSettings;
import com.cryptobot.backtester.optimizer.OptimizationResult;
import com.cryptobot.backtester.optimizer.OptimizationSummary;
import com.cryptobot.backtester.optimizer.ParameterGrid;
import com.cryptobot.backtester.optimizer.StrategyOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Service for parameter grid searches.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationService {

    private final StrategyOptimizer strategyOptimizer;
    private final MarketDataService marketDataService;
    private final BacktestResultStore resultStore;
    private final BacktestMetricsService metricsService;
    private final BacktestProperties properties;

    public OptimizationResponse optimize(OptimizationRequest request) {
        MDC.put("runId", UUID.randomUUID().toString());
        MDC.put("strategy", request.getStrategyName());
        long startTime = System.currentTimeMillis();

        try {
            StrategyType type = StrategyType.fromName(request.getStrategyName());
            ParameterGrid grid = ParameterGrid.of(request.getParameterRanges());
            List<PriceBar> bars = marketDataService.resolveBars(
                    request.getBars(), request.getSymbol(), request.getStartDate(), request.getEndDate());

            BacktestSettings defaults = BacktestSettings.from(properties);
            BacktestSettings settings = defaults.toBuilder()
                    .initialCapital(request.getInitialCapital() != null
                            ? request.getInitialCapital() : defaults.getInitialCapital())
                    .positionSizeFraction(request.getPositionSize() != null
                            ? request.getPositionSize() : defaults.getPositionSizeFraction())
                    .commissionRate(request.getCommission() != null
                            ? request.getCommission() : defaults.getCommissionRate())
                    .slippageRate(request.getSlippage() != null
                            ? request.getSlippage() : defaults.getSlippageRate())
                    .build();

            OptimizationSummary summary = strategyOptimizer.optimize(type, grid, bars, settings);
            metricsService.recordOptimization(summary.getEvaluated(), summary.getSkipped(),
                    System.currentTimeMillis() - startTime);

            Long runId = null;
            OptimizationResult best = summary.getBest();
            if (request.isPersist() && best != null) {
                BacktestRun run = resultStore.save(RunType.OPTIMIZATION, type, type.name(), request.getSymbol(),
                        summary, best.getTotalReturnPct(), best.getSharpeRatio(), best.getMaxDrawdown(), best.getWinRate());
                runId = run.getId();
            }

            return OptimizationResponse.builder()
                    .runId(runId)
                    .strategyName(type.name())
                    .symbol(request.getSymbol())
                    .evaluated(summary.getEvaluated())
                    .skipped(summary.getSkipped())
                    .results(summary.getResults())
                    .build();
        } catch (RuntimeException e) {
            metricsService.recordFailure();
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("strategy");
        }
    }
}
