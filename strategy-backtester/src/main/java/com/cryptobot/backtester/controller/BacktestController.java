package com.cryptobot.backtester.controller;

import com.cryptobot.backtester.controller.dto.BacktestRequest;
import com.cryptobot.backtester.controller.dto.BacktestResponse;
import com.cryptobot.backtester.controller.dto.ComparisonRequest;
import com.cryptobot.backtester.controller.dto.ComparisonResponse;
import com.cryptobot.backtester.controller.dto.OptimizationRequest;
import com.cryptobot.backtester.controller.dto.OptimizationResponse;
import com.cryptobot.backtester.controller.dto.RunSummaryResponse;
import com.cryptobot.backtester.service.BacktestService;
import com.cryptobot.backtester.service.OptimizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for backtest operations.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    private final BacktestService backtestService;
    private final OptimizationService optimizationService;

    /**
     * Run a backtest synchronously.
     *
     * @param request the backtest request
     * @return ledger, equity curve and performance report
     */
    @PostMapping
    public ResponseEntity<BacktestResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {

        log.info("POST /backtests - Strategy: {}, Symbol: {}",
                request.getStrategyName(), request.getSymbol());

        BacktestResponse response = backtestService.runBacktest(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Backtest several strategies over the same bars and rank them.
     */
    @PostMapping("/comparisons")
    public ResponseEntity<ComparisonResponse> compareStrategies(@Valid @RequestBody ComparisonRequest request) {

        log.info("POST /backtests/comparisons - Strategies: {}", request.getStrategies().size());

        return ResponseEntity.ok(backtestService.compareStrategies(request));
    }

    /**
     * Grid search over strategy parameters.
     */
    @PostMapping("/optimizations")
    public ResponseEntity<OptimizationResponse> optimize(@Valid @RequestBody OptimizationRequest request) {

        log.info("POST /backtests/optimizations - Strategy: {}, Parameters: {}",
                request.getStrategyName(), request.getParameterRanges().keySet());

        return ResponseEntity.ok(optimizationService.optimize(request));
    }

    /**
     * List stored runs, newest first.
     *
     * @param strategyName optional filter: a strategy type or alias, or an exact stored display name
     */
    @GetMapping("/runs")
    public ResponseEntity<List<RunSummaryResponse>> listRuns(
            @RequestParam(required = false) String strategyName) {

        log.info("GET /backtests/runs - Strategy: {}", strategyName);

        return ResponseEntity.ok(backtestService.listRuns(strategyName));
    }
}
