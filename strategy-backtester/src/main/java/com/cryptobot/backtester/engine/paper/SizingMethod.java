package com.cryptobot.backtester.engine.paper;

/**
 * How a paper session sizes a new position from available cash.
 */
public enum SizingMethod {
    /** A fixed fraction of cash per position. */
    FIXED_FRACTION,
    /** Kelly criterion over the session's closed positions so far. */
    KELLY
}
