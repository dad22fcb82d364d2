package com.cryptobot.backtester.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for database access and entity management.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.cryptobot.backtester.repository")
@EnableTransactionManagement
public class JpaConfig {
}
