package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.SignaledBar;

import java.util.List;
import java.util.Map;

/**
 * Strategy interface for implementing trading strategies.
 * A strategy maps a price series to one signal per bar and holds no state between calls.
 */
public interface Strategy {

    /**
     * Generate one signal per bar, in the order of the input.
     *
     * @param bars price series ordered by timestamp; every bar needs a timestamp and close
     * @return signaled bars, same length as the input
     * @throws com.cryptobot.backtester.exception.InvalidDataException if a required field is missing
     */
    List<SignaledBar> generateSignals(List<PriceBar> bars);

    /**
     * Get the strategy name.
     */
    String getName();

    String getDescription();

    /**
     * Parameters the strategy was built with, keyed by parameter name.
     */
    Map<String, Object> getParameters();
}
