package com.cryptobot.backtester.config;

import com.cryptobot.backtester.engine.BacktestEngine;
import com.cryptobot.backtester.engine.TradeSimulator;
import com.cryptobot.backtester.optimizer.StrategyOptimizer;
import com.cryptobot.backtester.risk.PortfolioRiskCalculator;
import com.cryptobot.backtester.risk.PositionSizer;
import com.cryptobot.backtester.risk.RiskCalculator;
import com.cryptobot.backtester.service.StrategyFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the stateless core components with the configured calculation scale and risk caps.
 */
@Configuration
public class EngineConfig {

    @Bean
    public BacktestEngine backtestEngine(BacktestProperties properties) {
        return new BacktestEngine(new TradeSimulator(properties.getCalcScale()));
    }

    @Bean
    public RiskCalculator riskCalculator(BacktestProperties properties) {
        return new RiskCalculator(properties.getCalcScale());
    }

    @Bean
    public PositionSizer positionSizer(BacktestProperties properties) {
        return new PositionSizer(properties.getCalcScale(), properties.getMaxKellyFraction());
    }

    @Bean
    public PortfolioRiskCalculator portfolioRiskCalculator(BacktestProperties properties) {
        return new PortfolioRiskCalculator(properties.getCalcScale(), properties.getMaxPortfolioRisk());
    }

    @Bean
    public StrategyOptimizer strategyOptimizer(StrategyFactory strategyFactory, BacktestEngine backtestEngine,
            @Qualifier("optimizerExecutor") ThreadPoolTaskExecutor optimizerExecutor,
            BacktestProperties properties) {
        return new StrategyOptimizer(strategyFactory, backtestEngine, optimizerExecutor,
                properties.getOptimizer().getParallelism(), properties.getOptimizer().getMaxCombinations());
    }
}
