package com.cryptobot.backtester.optimizer;

import com.cryptobot.backtester.domain.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * All evaluated combinations, best total return first.
 */
@Value
@Builder
public class OptimizationSummary {
    StrategyType strategyType;
    int evaluated;

    /**
     * Combinations rejected by parameter validation.
     */
    int skipped;

    List<OptimizationResult> results;

    public OptimizationResult getBest() {
        return results.isEmpty() ? null : results.get(0);
    }
}
