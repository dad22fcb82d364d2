package com.cryptobot.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketDataIngestionResponse {
    private String symbol;
    private int received;
    private int inserted;
}
