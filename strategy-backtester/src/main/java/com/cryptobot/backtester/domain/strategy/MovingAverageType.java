package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.exception.ParameterValidationException;

import java.util.Locale;

public enum MovingAverageType {
    SMA,
    EMA;

    public static MovingAverageType parse(String value) {
        if (value == null || value.isBlank()) {
            return SMA;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParameterValidationException("Unknown moving average type: " + value, e);
        }
    }
}
