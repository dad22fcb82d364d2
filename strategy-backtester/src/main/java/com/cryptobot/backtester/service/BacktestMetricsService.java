package com.cryptobot.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest execution metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCounter;
    private final Counter failedRunsCounter;
    private final Counter optimizerTrialsCounter;
    private final Counter optimizerSkippedCounter;
    private final Counter paperSessionsCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCounter = Counter.builder("backtest.runs")
                .description("Total number of backtests executed")
                .register(meterRegistry);

        this.failedRunsCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of runs that ended with an error")
                .register(meterRegistry);

        this.optimizerTrialsCounter = Counter.builder("backtest.optimizer.trials")
                .description("Parameter combinations evaluated by the optimizer")
                .register(meterRegistry);

        this.optimizerSkippedCounter = Counter.builder("backtest.optimizer.skipped")
                .description("Parameter combinations rejected by validation")
                .register(meterRegistry);

        this.paperSessionsCounter = Counter.builder("backtest.paper.sessions")
                .description("Total number of paper-trading sessions")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed backtest with execution time.
     */
    public void recordRun(long executionTimeMs) {
        runsCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordOptimization(int evaluated, int skipped, long executionTimeMs) {
        optimizerTrialsCounter.increment(evaluated);
        optimizerSkippedCounter.increment(skipped);
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordPaperSession(long executionTimeMs) {
        paperSessionsCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordFailure() {
        failedRunsCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Runs=%d, Failed=%d, Trials=%d, Skipped=%d, PaperSessions=%d, AvgExecTime=%.2fs",
                (long) runsCounter.count(),
                (long) failedRunsCounter.count(),
                (long) optimizerTrialsCounter.count(),
                (long) optimizerSkippedCounter.count(),
                (long) paperSessionsCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
