package com.cryptobot.backtester.exception;

/**
 * Thrown when strategy parameters are malformed, e.g. a fast period that is not
 * below the slow period or an oversold level above the overbought level.
 */
public class ParameterValidationException extends BacktestException {

    public ParameterValidationException(String message) {
        super("invalid_parameters", message);
    }

    public ParameterValidationException(String message, Throwable cause) {
        super("invalid_parameters", message, cause);
    }
}
