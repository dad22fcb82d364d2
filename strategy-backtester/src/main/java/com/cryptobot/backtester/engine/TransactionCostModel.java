package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.domain.TransactionCosts;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proportional commission and slippage charged on the absolute cash flow of each fill.
 * Each trade's portfolio value is reduced by that trade's own costs; the final value by the total.
 */
@Slf4j
@Getter
public class TransactionCostModel {

    private final BigDecimal commissionRate;
    private final BigDecimal slippageRate;

    public TransactionCostModel(BigDecimal commissionRate, BigDecimal slippageRate) {
        this.commissionRate = commissionRate;
        this.slippageRate = slippageRate;
    }

    public SimulationResult apply(SimulationResult simulation) {
        if (simulation.getTrades().isEmpty()) {
            return simulation.toBuilder().transactionCosts(TransactionCosts.NONE).build();
        }

        BigDecimal totalCommission = BigDecimal.ZERO;
        BigDecimal totalSlippage = BigDecimal.ZERO;
        List<Trade> adjusted = new ArrayList<>(simulation.getTrades().size());

        for (Trade trade : simulation.getTrades()) {
            BigDecimal notional = trade.getCashFlow().abs();
            BigDecimal commission = notional.multiply(commissionRate);
            BigDecimal slippage = notional.multiply(slippageRate);
            totalCommission = totalCommission.add(commission);
            totalSlippage = totalSlippage.add(slippage);

            BigDecimal netValue = trade.getPortfolioValue().subtract(commission).subtract(slippage);
            adjusted.add(trade.withCosts(commission, slippage, netValue));
        }

        BigDecimal totalCosts = totalCommission.add(totalSlippage);
        log.info("Transaction costs applied: ${}", totalCosts.setScale(2, RoundingMode.HALF_UP));

        return simulation.toBuilder()
                .trades(Collections.unmodifiableList(adjusted))
                .finalValue(simulation.getFinalValue().subtract(totalCosts))
                .transactionCosts(TransactionCosts.builder()
                        .totalCommission(totalCommission)
                        .totalSlippage(totalSlippage)
                        .totalCosts(totalCosts)
                        .build())
                .build();
    }
}
