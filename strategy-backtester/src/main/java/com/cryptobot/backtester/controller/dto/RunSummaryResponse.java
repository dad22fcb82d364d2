package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunSummaryResponse {
    private Long id;
    private RunType runType;
    private StrategyType strategyKey;
    private String strategyName;
    private String symbol;
    private LocalDateTime createdAt;
    private BigDecimal totalReturnPct;
    private BigDecimal sharpeRatio;
    private BigDecimal maxDrawdown;
    private BigDecimal winRate;

    public static RunSummaryResponse from(BacktestRun run) {
        return RunSummaryResponse.builder()
                .id(run.getId())
                .runType(run.getRunType())
                .strategyKey(run.getStrategyKey())
                .strategyName(run.getStrategyName())
                .symbol(run.getSymbol())
                .createdAt(run.getCreatedAt())
                .totalReturnPct(run.getTotalReturnPct())
                .sharpeRatio(run.getSharpeRatio())
                .maxDrawdown(run.getMaxDrawdown())
                .winRate(run.getWinRate())
                .build();
    }
}
