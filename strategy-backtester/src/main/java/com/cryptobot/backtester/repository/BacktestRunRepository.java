package com.cryptobot.backtester.repository;

import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for stored runs.
 */
@Repository
public interface BacktestRunRepository extends JpaRepository<BacktestRun, Long> {

    /**
     * Runs of one strategy, newest first.
     */
    List<BacktestRun> findByStrategyNameOrderByCreatedAtDesc(String strategyName);

    List<BacktestRun> findByStrategyKeyOrderByCreatedAtDesc(StrategyType strategyKey);

    List<BacktestRun> findTop50ByOrderByCreatedAtDesc();
}
