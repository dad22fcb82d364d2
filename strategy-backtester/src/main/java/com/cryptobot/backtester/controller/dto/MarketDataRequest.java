package com.cryptobot.backtester.controller.dto;

import com.cryptobot.backtester.domain.PriceBar;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;
import java.util.List;

/**
 * Price data for a request: either inline bars, or a symbol and date range to load.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
public abstract class MarketDataRequest {

    private String symbol;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    /**
     * Inline bars; when present they take precedence over symbol and dates.
     */
    private List<PriceBar> bars;

    @JsonIgnore
    @AssertTrue(message = "Either bars or symbol, startDate and endDate are required")
    public boolean isMarketDataSpecified() {
        if (bars != null && !bars.isEmpty()) {
            return true;
        }
        return symbol != null && !symbol.isBlank() && startDate != null && endDate != null;
    }
}
