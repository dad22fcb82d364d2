package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A single OHLCV bar for one symbol and interval.
 * Optional precomputed indicator columns (sma_10, rsi, macd, ...) travel with the bar.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PriceBar {

    Instant timestamp;
    String symbol;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    Long volume;

    @Builder.Default
    Map<String, Double> indicators = Map.of();

    public boolean hasIndicator(String column) {
        return indicators != null && indicators.containsKey(column);
    }

    /**
     * Get a precomputed indicator value, or NaN when the column is absent or null.
     */
    public double getIndicator(String column) {
        Double value = hasIndicator(column) ? indicators.get(column) : null;
        return value == null ? Double.NaN : value;
    }
}
