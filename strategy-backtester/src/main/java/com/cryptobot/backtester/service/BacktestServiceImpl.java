package com.cryptobot.backtester.service;

import com.cryptobot.backtester.config.BacktestProperties;
import com.cryptobot.backtester.controller.dto.BacktestRequest;
import com.cryptobot.backtester.controller.dto.BacktestResponse;
import com.cryptobot.backtester.controller.dto.ComparisonRequest;
import com.cryptobot.backtester.controller.dto.ComparisonResponse;
import com.cryptobot.backtester.controller.dto.RunSummaryResponse;
import com.cryptobot.backtester.controller.dto.StrategySpec;
import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.StrategyComparison;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.engine.BacktestEngine;
import com.cryptobot.backtester.engine.BacktestResult;
import com.cryptobot.backtester.engine.BacktestSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Implementation of BacktestService running backtests synchronously on the caller's thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final StrategyFactory strategyFactory;
    private final MarketDataService marketDataService;
    private final BacktestEngine backtestEngine;
    private final BacktestResultStore resultStore;
    private final BacktestMetricsService metricsService;
    private final BacktestProperties properties;

    @Override
    public BacktestResponse runBacktest(BacktestRequest request) {
        MDC.put("runId", UUID.randomUUID().toString());
        MDC.put("strategy", request.getStrategyName());
        long startTime = System.currentTimeMillis();

        try {
            log.info("Received backtest for strategy: {}, symbol: {}",
                    request.getStrategyName(), request.getSymbol());

            Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), request.getParameters());
            List<PriceBar> bars = marketDataService.resolveBars(
                    request.getBars(), request.getSymbol(), request.getStartDate(), request.getEndDate());

            BacktestSettings settings = settings(request.getInitialCapital(), request.getPositionSize(),
                    request.getCommission(), request.getSlippage());
            BacktestResult result = backtestEngine.run(strategy, bars, settings);

            Long runId = null;
            if (request.isPersist()) {
                BacktestRun run = resultStore.save(RunType.BACKTEST, StrategyType.fromName(request.getStrategyName()),
                        result.getStrategyName(), request.getSymbol(), result.getPerformance(), result);
                runId = run.getId();
            }

            metricsService.recordRun(System.currentTimeMillis() - startTime);
            log.debug(metricsService.getMetricsSummary());
            return BacktestResponse.from(result, request.getSymbol(), runId);
        } catch (RuntimeException e) {
            metricsService.recordFailure();
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("strategy");
        }
    }

    @Override
    public ComparisonResponse compareStrategies(ComparisonRequest request) {
        MDC.put("runId", UUID.randomUUID().toString());
        MDC.put("strategy", "comparison");

        try {
            List<Strategy> strategies = new ArrayList<>();
            for (StrategySpec spec : request.getStrategies()) {
                strategies.add(strategyFactory.createStrategy(spec.getStrategyName(), spec.getParameters()));
            }

            List<PriceBar> bars = marketDataService.resolveBars(
                    request.getBars(), request.getSymbol(), request.getStartDate(), request.getEndDate());
            BacktestSettings settings = settings(request.getInitialCapital(), null,
                    request.getCommission(), request.getSlippage());

            List<StrategyComparison> rows = compareStrategies(strategies, bars, settings);

            Long runId = null;
            if (request.isPersist() && !rows.isEmpty()) {
                StrategyComparison best = rows.get(0);
                String names = rows.stream()
                        .map(StrategyComparison::getStrategyName)
                        .collect(Collectors.joining(" vs "));
                BacktestRun run = resultStore.save(RunType.COMPARISON, null, truncate(names), request.getSymbol(), rows,
                        best.getTotalReturnPct(), best.getSharpeRatio(), best.getMaxDrawdown(), best.getWinRate());
                runId = run.getId();
            }

            return ComparisonResponse.builder()
                    .runId(runId)
                    .symbol(request.getSymbol())
                    .results(rows)
                    .build();
        } catch (RuntimeException e) {
            metricsService.recordFailure();
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("strategy");
        }
    }

    @Override
    public List<StrategyComparison> compareStrategies(List<Strategy> strategies, List<PriceBar> bars,
            BacktestSettings settings) {
        log.info("Comparing {} strategies...", strategies.size());

        List<StrategyComparison> rows = new ArrayList<>(strategies.size());
        for (Strategy strategy : strategies) {
            long startTime = System.currentTimeMillis();
            log.info("Testing: {}", strategy.getName());
            BacktestResult result = backtestEngine.run(strategy, bars, settings);
            rows.add(StrategyComparison.of(result.getStrategyName(), result.getPerformance()));
            metricsService.recordRun(System.currentTimeMillis() - startTime);
        }

        rows.sort(Comparator.comparing(StrategyComparison::getTotalReturnPct).reversed());
        log.info("Strategy comparison complete - best: {}", rows.isEmpty() ? "none" : rows.get(0).getStrategyName());
        return rows;
    }

    @Override
    public List<RunSummaryResponse> listRuns(String strategyName) {
        return resultStore.findRuns(strategyName).stream()
                .map(RunSummaryResponse::from)
                .collect(Collectors.toList());
    }

    private BacktestSettings settings(BigDecimal initialCapital, BigDecimal positionSize,
            BigDecimal commission, BigDecimal slippage) {
        BacktestSettings defaults = BacktestSettings.from(properties);
        return defaults.toBuilder()
                .initialCapital(initialCapital != null ? initialCapital : defaults.getInitialCapital())
                .positionSizeFraction(positionSize != null ? positionSize : defaults.getPositionSizeFraction())
                .commissionRate(commission != null ? commission : defaults.getCommissionRate())
                .slippageRate(slippage != null ? slippage : defaults.getSlippageRate())
                .build();
    }

    private static String truncate(String name) {
        return name.length() <= 100 ? name : name.substring(0, 100);
    }
}
