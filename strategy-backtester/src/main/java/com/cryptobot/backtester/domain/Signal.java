package com.cryptobot.backtester.domain;

/**
 * Discrete trading decision emitted for each bar.
 */
public enum Signal {
    BUY,
    SELL,
    HOLD
}
