package com.cryptobot.backtester.domain.strategy;

import com.cryptobot.backtester.exception.ParameterValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registry of built-in strategy variants and the names they are requested by.
 */
@Getter
@RequiredArgsConstructor
public enum StrategyType {
    MA_CROSSOVER(List.of("ma_crossover", "moving_average_crossover", "ma-crossover")),
    RSI_MEAN_REVERSION(List.of("rsi", "rsi_mean_reversion", "rsi-mean-reversion")),
    MACD_CROSSOVER(List.of("macd", "macd_crossover")),
    BOLLINGER_BANDS(List.of("bollinger", "bollinger_bands", "bb")),
    BUY_AND_HOLD(List.of("buy_and_hold", "buy-and-hold", "buyandhold"));

    private final List<String> aliases;

    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ParameterValidationException("Strategy name is required");
        }
        return lookup(name).orElseThrow(() -> new ParameterValidationException("Unknown strategy: " + name));
    }

    /**
     * Resolve a type name or alias, case-insensitively; empty for null, blank or unknown names.
     */
    public static Optional<StrategyType> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(normalized) || type.aliases.contains(normalized))
                .findFirst();
    }
}
