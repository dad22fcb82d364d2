package com.cryptobot.backtester.domain;

/**
 * Kind of run stored in the result store.
 */
public enum RunType {
    BACKTEST,
    OPTIMIZATION,
    COMPARISON,
    PAPER_TRADING
}
