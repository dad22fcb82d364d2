package com.cryptobot.backtester.service;

import com.cryptobot.backtester.config.BacktestProperties;
import com.cryptobot.backtester.controller.dto.PaperTradingRequest;
import com.cryptobot.backtester.controller.dto.PaperTradingResponse;
import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.engine.EquityCurveBuilder;
import com.cryptobot.backtester.engine.PerformanceMetrics;
import com.cryptobot.backtester.engine.paper.PaperTradingResult;
import com.cryptobot.backtester.engine.paper.PaperTradingSession;
import com.cryptobot.backtester.engine.paper.PaperTradingSettings;
import com.cryptobot.backtester.engine.paper.SizingMethod;
import com.cryptobot.backtester.risk.PortfolioRiskCalculator;
import com.cryptobot.backtester.risk.PositionSizer;
import com.cryptobot.backtester.risk.RiskCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Service for running paper-trading sessions over historical bars.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaperTradingService {

    private final StrategyFactory strategyFactory;
    private final MarketDataService marketDataService;
    private final RiskCalculator riskCalculator;
    private final PositionSizer positionSizer;
    private final PortfolioRiskCalculator portfolioRiskCalculator;
    private final BacktestResultStore resultStore;
    private final BacktestMetricsService metricsService;
    private final BacktestProperties properties;

    public PaperTradingResponse runSession(PaperTradingRequest request) {
        MDC.put("runId", UUID.randomUUID().toString());
        MDC.put("strategy", request.getStrategyName());
        long startTime = System.currentTimeMillis();

        try {
            Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), request.getParameters());
            List<PriceBar> bars = marketDataService.resolveBars(
                    request.getBars(), request.getSymbol(), request.getStartDate(), request.getEndDate());

            PaperTradingSettings defaults = PaperTradingSettings.from(properties);
            PaperTradingSettings settings = defaults.toBuilder()
                    .initialCapital(request.getInitialCapital() != null
                            ? request.getInitialCapital() : defaults.getInitialCapital())
                    .positionSizeFraction(request.getPositionSize() != null
                            ? request.getPositionSize() : defaults.getPositionSizeFraction())
                    .stopLossPct(request.getStopLossPct() != null
                            ? request.getStopLossPct() : defaults.getStopLossPct())
                    .takeProfitPct(request.getTakeProfitPct() != null
                            ? request.getTakeProfitPct() : defaults.getTakeProfitPct())
                    .trailingStopPct(request.getTrailingStopPct())
                    .sizingMethod(request.getSizingMethod() != null
                            ? request.getSizingMethod() : SizingMethod.FIXED_FRACTION)
                    .build();

            PaperTradingSession session = new PaperTradingSession(settings, riskCalculator, positionSizer,
                    portfolioRiskCalculator, properties.getCalcScale());
            PaperTradingResult result = session.run(strategy, bars);
            metricsService.recordPaperSession(System.currentTimeMillis() - startTime);

            PaperTradingResponse response = PaperTradingResponse.from(result, request.getSymbol(), null);
            if (request.isPersist()) {
                List<BigDecimal> equity = EquityCurveBuilder.values(result.getEquityCurve());
                BacktestRun run = resultStore.save(RunType.PAPER_TRADING,
                        StrategyType.fromName(request.getStrategyName()), result.getStrategyName(),
                        request.getSymbol(), response, result.getTotalReturnPct(),
                        PerformanceMetrics.calculateSharpeRatio(equity),
                        PerformanceMetrics.calculateMaxDrawdown(equity),
                        result.getWinRate());
                response.setRunId(run.getId());
            }
            return response;
        } catch (RuntimeException e) {
            metricsService.recordFailure();
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("strategy");
        }
    }
}
