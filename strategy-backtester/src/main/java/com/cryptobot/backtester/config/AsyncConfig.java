package com.cryptobot.backtester.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for parallel optimizer trials.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "optimizerExecutor")
    public ThreadPoolTaskExecutor optimizerExecutor(BacktestProperties properties) {
        int parallelism = properties.getOptimizer().getParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("Optimizer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
