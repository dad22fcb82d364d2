package com.cryptobot.backtester.risk;

public enum PositionDirection {
    LONG,
    SHORT
}
