package com.cryptobot.backtester.exception;

import lombok.Getter;

/**
 * Base class for recoverable failures raised by the backtesting core.
 */
@Getter
public class BacktestException extends RuntimeException {

    private final String code;

    public BacktestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BacktestException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
