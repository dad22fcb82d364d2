package com.cryptobot.backtester.domain;

import com.cryptobot.backtester.domain.strategy.StrategyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A stored backtest, comparison, optimization or paper-trading run.
 * Keyed by strategy type, display name and creation time; the full result bundle is kept as JSON.
 */
@Entity
@Table(name = "backtest_runs", indexes = {
        @Index(name = "idx_strategy_created", columnList = "strategy_name, created_at"),
        @Index(name = "idx_strategy_key_created", columnList = "strategy_key, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 20)
    private RunType runType;

    /**
     * Strategy type the run was requested as; null for comparisons across several types.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "strategy_key", length = 30)
    private StrategyType strategyKey;

    @Column(name = "strategy_name", nullable = false, length = 100)
    private String strategyName;

    @Column(name = "symbol", length = 20)
    private String symbol;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "total_return_pct", precision = 19, scale = 4)
    private BigDecimal totalReturnPct;

    @Column(name = "sharpe_ratio", precision = 19, scale = 4)
    private BigDecimal sharpeRatio;

    @Column(name = "max_drawdown", precision = 19, scale = 4)
    private BigDecimal maxDrawdown;

    @Column(name = "win_rate", precision = 19, scale = 4)
    private BigDecimal winRate;

    @Lob
    @Column(name = "result_json")
    private String resultJson;
}
