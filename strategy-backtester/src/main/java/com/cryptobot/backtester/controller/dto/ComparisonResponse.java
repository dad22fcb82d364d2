package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.StrategyComparison;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Comparison rows, best total return first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonResponse {
    private Long runId;
    private String symbol;
    private List<StrategyComparison> results;
}
