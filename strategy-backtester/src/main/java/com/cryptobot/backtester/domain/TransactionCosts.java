package com.cryptobot.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransactionCosts {

    public static final TransactionCosts NONE = TransactionCosts.builder()
            .totalCommission(BigDecimal.ZERO)
            .totalSlippage(BigDecimal.ZERO)
            .totalCosts(BigDecimal.ZERO)
            .build();

    BigDecimal totalCommission;
    BigDecimal totalSlippage;
    BigDecimal totalCosts;
}
