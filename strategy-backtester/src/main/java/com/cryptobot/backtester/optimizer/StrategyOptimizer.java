package com.cryptobot.backtester.optimizer;

import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.engine.BacktestEngine;
import com.cryptobot.backtester.engine.BacktestSettings;
import com.cryptobot.backtester.exception.BacktestException;
import com.cryptobot.backtester.exception.ParameterValidationException;
import com.cryptobot.backtester.service.StrategyFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Exhaustive grid search: backtests every valid parameter combination and ranks them by total return.
 * With parallelism above 1 the trials run on the supplied executor, each over its own copy of the bars.
 */
@Slf4j
public class StrategyOptimizer {

    public static final int DEFAULT_MAX_COMBINATIONS = 10_000;

    private final StrategyFactory strategyFactory;
    private final BacktestEngine engine;
    private final Executor executor;
    private final int parallelism;
    private final int maxCombinations;

    public StrategyOptimizer(StrategyFactory strategyFactory, BacktestEngine engine, Executor executor,
            int parallelism, int maxCombinations) {
        this.strategyFactory = strategyFactory;
        this.engine = engine;
        this.executor = executor;
        this.parallelism = parallelism;
        this.maxCombinations = maxCombinations;
    }

    public StrategyOptimizer(StrategyFactory strategyFactory, BacktestEngine engine, Executor executor, int parallelism) {
        this(strategyFactory, engine, executor, parallelism, DEFAULT_MAX_COMBINATIONS);
    }

    public StrategyOptimizer(StrategyFactory strategyFactory, BacktestEngine engine) {
        this(strategyFactory, engine, null, 1);
    }

    public OptimizationSummary optimize(StrategyType type, ParameterGrid grid, List<PriceBar> bars,
            BacktestSettings settings) {
        grid.requireAtMost(maxCombinations);
        log.info("Optimizing {} parameters over {} combinations", type, grid.size());

        List<Map<String, Object>> combinations = grid.combinations();
        List<Strategy> strategies = new ArrayList<>(combinations.size());
        int skipped = 0;

        for (Map<String, Object> params : combinations) {
            try {
                strategies.add(strategyFactory.createStrategy(type, params));
            } catch (ParameterValidationException e) {
                skipped++;
                log.debug("Skipping {} {}: {}", type, params, e.getMessage());
            }
        }

        List<OptimizationResult> results = parallelism > 1 && executor != null
                ? runParallel(strategies, bars, settings)
                : runSequential(strategies, bars, settings);

        results.sort(Comparator.comparing(OptimizationResult::getTotalReturnPct).reversed());

        log.info("Optimization complete - evaluated: {}, skipped: {}, best: {}",
                results.size(), skipped, results.isEmpty() ? "none" : results.get(0).getParameters());

        return OptimizationSummary.builder()
                .strategyType(type)
                .evaluated(results.size())
                .skipped(skipped)
                .results(results)
                .build();
    }

    private List<OptimizationResult> runSequential(List<Strategy> strategies, List<PriceBar> bars,
            BacktestSettings settings) {
        List<OptimizationResult> results = new ArrayList<>(strategies.size());
        for (Strategy strategy : strategies) {
            results.add(runTrial(strategy, bars, settings));
        }
        return results;
    }

    private List<OptimizationResult> runParallel(List<Strategy> strategies, List<PriceBar> bars,
            BacktestSettings settings) {
        log.debug("Running {} trials with parallelism {}", strategies.size(), parallelism);
        OptimizationResult[] slots = new OptimizationResult[strategies.size()];
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<Void>> futures = new ArrayList<>(strategies.size());

        for (int i = 0; i < strategies.size(); i++) {
            int slot = i;
            Strategy strategy = strategies.get(i);
            List<PriceBar> trialBars = new ArrayList<>(bars);
            futures.add(CompletableFuture.runAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    slots[slot] = runTrial(strategy, trialBars, settings);
                } finally {
                    MDC.clear();
                }
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Optimization trial failed, discarding partial results: {}", cause.getMessage());
            if (cause instanceof BacktestException) {
                throw (BacktestException) cause;
            }
            throw new BacktestException("optimization_failed", "Optimization trial failed: " + cause.getMessage(), cause);
        }

        List<OptimizationResult> results = new ArrayList<>(slots.length);
        for (OptimizationResult result : slots) {
            results.add(result);
        }
        return results;
    }

    private OptimizationResult runTrial(Strategy strategy, List<PriceBar> bars, BacktestSettings settings) {
        log.debug("Testing {}", strategy.getParameters());
        PerformanceReport performance = engine.run(strategy, bars, settings).getPerformance();
        return OptimizationResult.builder()
                .parameters(strategy.getParameters())
                .totalReturn(performance.getTotalReturn())
                .totalReturnPct(performance.getTotalReturnPct())
                .numTrades(performance.getNumCompletedTrades())
                .winRate(performance.getWinRate())
                .sharpeRatio(performance.getSharpeRatio())
                .maxDrawdown(performance.getMaxDrawdown())
                .build();
    }
}
