package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PerformanceReport;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.domain.strategy.Strategy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Core backtesting engine: signals, simulated fills, transaction costs, equity curve and metrics.
 * Stateless; one instance can serve concurrent runs.
 */
@Slf4j
public class BacktestEngine {

    private final TradeSimulator simulator;

    public BacktestEngine(TradeSimulator simulator) {
        this.simulator = simulator;
    }

    public BacktestEngine() {
        this(new TradeSimulator());
    }

    /**
     * Run a backtest of {@code strategy} over {@code bars}.
     */
    public BacktestResult run(Strategy strategy, List<PriceBar> bars, BacktestSettings settings) {
        log.info("Starting backtest - Strategy: {}, Data points: {}, Initial capital: {}",
                strategy.getName(), bars == null ? 0 : bars.size(), settings.getInitialCapital());
        if (bars != null && !bars.isEmpty()) {
            log.info("Data period: {} to {}", bars.get(0).getTimestamp(), bars.get(bars.size() - 1).getTimestamp());
        }

        List<SignaledBar> signaledBars = strategy.generateSignals(bars);

        SimulationResult simulation = simulator.simulate(
                signaledBars, settings.getInitialCapital(), settings.getPositionSizeFraction());
        log.info("Strategy execution complete: {} trades", simulation.getTrades().size());

        TransactionCostModel costModel = new TransactionCostModel(settings.getCommissionRate(), settings.getSlippageRate());
        SimulationResult costed = costModel.apply(simulation);

        List<EquityPoint> equityCurve = EquityCurveBuilder.build(bars, costed.getTrades(), settings.getInitialCapital());
        PerformanceReport performance = PerformanceMetrics.buildReport(
                settings.getInitialCapital(), costed.getFinalValue(), costed.getTrades(), equityCurve);

        log.info("Backtest completed - Total Return: {}%, Sharpe: {}, Max DD: {}%, Win Rate: {}%, Trades: {}",
                performance.getTotalReturnPct(), performance.getSharpeRatio(), performance.getMaxDrawdown(),
                performance.getWinRate(), performance.getNumTrades());

        return BacktestResult.builder()
                .strategyName(strategy.getName())
                .parameters(strategy.getParameters())
                .signaledBars(signaledBars)
                .trades(costed.getTrades())
                .equityCurve(equityCurve)
                .performance(performance)
                .transactionCosts(costed.getTransactionCosts())
                .finalCash(costed.getFinalCash())
                .finalPosition(costed.getFinalPosition())
                .build();
    }
}
