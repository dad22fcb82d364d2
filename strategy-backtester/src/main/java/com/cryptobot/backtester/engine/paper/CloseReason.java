package com.cryptobot.backtester.engine.paper;

public enum CloseReason {
    STOP_LOSS,
    TAKE_PROFIT,
    SIGNAL,
    END_OF_SESSION
}
