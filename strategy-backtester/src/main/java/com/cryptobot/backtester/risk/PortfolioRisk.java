package com.cryptobot.backtester.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PortfolioRisk {

    public static final PortfolioRisk EMPTY = PortfolioRisk.builder()
            .totalExposure(BigDecimal.ZERO)
            .totalRisk(BigDecimal.ZERO)
            .portfolioRiskPct(BigDecimal.ZERO)
            .numPositions(0)
            .leverage(BigDecimal.ZERO)
            .build();

    BigDecimal totalExposure;
    BigDecimal totalRisk;

    /**
     * Total risk as a percentage of capital (5 means 5 %).
     */
    BigDecimal portfolioRiskPct;

    int numPositions;
    BigDecimal leverage;
}
