package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.optimizer.OptimizationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a parameter grid search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationResponse {
    private Long runId;
    private String strategyName;
    private String symbol;
    private int evaluated;
    private int skipped;
    private List<OptimizationResult> results;
}
