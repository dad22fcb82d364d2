package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.domain.TransactionCosts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trade ledger and closing state of a simulation.
 * An open position at the end is valued at the last close, not sold.
 */
@Value
@Builder(toBuilder = true)
public class SimulationResult {

    List<Trade> trades;

    /**
     * Cash left after the last trade, before transaction costs.
     */
    BigDecimal finalCash;

    BigDecimal finalPosition;
    BigDecimal finalValue;

    @Builder.Default
    TransactionCosts transactionCosts = TransactionCosts.NONE;
}
