package com.cryptobot.backtester.service;

import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.exception.BacktestException;
import com.cryptobot.backtester.repository.BacktestRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Persists run results as JSON, keyed by strategy type, display name and creation time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestResultStore {

    private final BacktestRunRepository backtestRunRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public BacktestRun save(RunType runType, StrategyType strategyKey, String strategyName, String symbol,
            PerformanceReport performance, Object payload) {
        return save(runType, strategyKey, strategyName, symbol, payload,
                performance.getTotalReturnPct(), performance.getSharpeRatio(),
                performance.getMaxDrawdown(), performance.getWinRate());
    }

    @Transactional
    public BacktestRun save(RunType runType, StrategyType strategyKey, String strategyName, String symbol,
            Object payload, BigDecimal totalReturnPct, BigDecimal sharpeRatio, BigDecimal maxDrawdown,
            BigDecimal winRate) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BacktestException("serialization_failed",
                    "Failed to serialize " + runType + " result for " + strategyName, e);
        }

        BacktestRun run = BacktestRun.builder()
                .runType(runType)
                .strategyKey(strategyKey)
                .strategyName(strategyName)
                .symbol(symbol)
                .createdAt(LocalDateTime.now())
                .totalReturnPct(totalReturnPct)
                .sharpeRatio(sharpeRatio)
                .maxDrawdown(maxDrawdown)
                .winRate(winRate)
                .resultJson(json)
                .build();

        BacktestRun saved = backtestRunRepository.save(run);
        log.info("Saved {} run {} for {}", runType, saved.getId(), strategyName);
        return saved;
    }

    /**
     * Stored runs for a strategy, newest first. A type name or alias such as {@code ma_crossover}
     * matches every run of that type; any other value matches the display name exactly.
     * A null or blank filter lists the most recent runs of any strategy.
     */
    @Transactional(readOnly = true)
    public List<BacktestRun> findRuns(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return backtestRunRepository.findTop50ByOrderByCreatedAtDesc();
        }
        return StrategyType.lookup(strategy)
                .map(backtestRunRepository::findByStrategyKeyOrderByCreatedAtDesc)
                .orElseGet(() -> backtestRunRepository.findByStrategyNameOrderByCreatedAtDesc(strategy));
    }
}
