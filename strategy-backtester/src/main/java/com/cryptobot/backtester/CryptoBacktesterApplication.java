package com.cryptobot.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the crypto strategy backtester.
 * Runs backtests, comparisons, parameter searches and paper-trading sessions over historical bars.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CryptoBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoBacktesterApplication.class, args);
    }

}
