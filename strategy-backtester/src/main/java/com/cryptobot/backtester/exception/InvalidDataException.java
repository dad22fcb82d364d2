package com.cryptobot.backtester.exception;

/**
 * Thrown when a price series is missing fields the core cannot do without
 * (timestamp, close).
 */
public class InvalidDataException extends BacktestException {

    public InvalidDataException(String message) {
        super("invalid_data", message);
    }
}
