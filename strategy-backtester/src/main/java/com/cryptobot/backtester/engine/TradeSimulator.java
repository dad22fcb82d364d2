package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.domain.Trade;
import com.cryptobot.backtester.exception.InvalidDataException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a signaled price series into a ledger of fills, holding at most one long position.
 * A BUY while flat spends a fixed fraction of cash; a SELL while long liquidates everything.
 * Every other signal/state combination is ignored.
 */
@Slf4j
public class TradeSimulator {

    public static final BigDecimal DEFAULT_POSITION_SIZE = new BigDecimal("0.95");

    private final int scale;

    public TradeSimulator(int scale) {
        this.scale = scale;
    }

    public TradeSimulator() {
        this(10);
    }

    public SimulationResult simulate(List<SignaledBar> signaledBars, BigDecimal initialCapital) {
        return simulate(signaledBars, initialCapital, DEFAULT_POSITION_SIZE);
    }

    public SimulationResult simulate(List<SignaledBar> signaledBars, BigDecimal initialCapital,
            BigDecimal positionSizeFraction) {
        BigDecimal cash = initialCapital;
        BigDecimal position = BigDecimal.ZERO;
        List<Trade> trades = new ArrayList<>();

        for (SignaledBar bar : signaledBars) {
            Signal signal = bar.getSignal();
            BigDecimal price = bar.getClose();
            if (signal == null || price == null) {
                continue;
            }
            if (price.signum() <= 0) {
                throw new InvalidDataException("Non-positive close " + price + " at " + bar.getTimestamp());
            }

            boolean flat = position.signum() == 0;

            if (signal == Signal.BUY && flat && cash.signum() > 0) {
                BigDecimal spend = cash.multiply(positionSizeFraction);
                BigDecimal quantity = spend.divide(price, scale, RoundingMode.HALF_UP);
                position = quantity;
                cash = cash.subtract(spend);

                trades.add(Trade.builder()
                        .timestamp(bar.getTimestamp())
                        .symbol(bar.getBar().getSymbol())
                        .type(Trade.TradeType.BUY)
                        .price(price)
                        .quantity(quantity)
                        .cashFlow(spend.negate())
                        .portfolioValue(cash.add(quantity.multiply(price)))
                        .build());
                log.debug("BUY: {} units at {}", quantity, price);
            } else if (signal == Signal.SELL && !flat) {
                BigDecimal proceeds = position.multiply(price);
                cash = cash.add(proceeds);

                trades.add(Trade.builder()
                        .timestamp(bar.getTimestamp())
                        .symbol(bar.getBar().getSymbol())
                        .type(Trade.TradeType.SELL)
                        .price(price)
                        .quantity(position)
                        .cashFlow(proceeds)
                        .portfolioValue(cash)
                        .build());
                log.debug("SELL: {} units at {}", position, price);
                position = BigDecimal.ZERO;
            } else if (signal != Signal.HOLD) {
                log.debug("Ignoring {} at {} (position: {}, cash: {})", signal, bar.getTimestamp(), position, cash);
            }
        }

        BigDecimal lastClose = signaledBars.isEmpty()
                ? BigDecimal.ZERO
                : signaledBars.get(signaledBars.size() - 1).getClose();
        BigDecimal finalValue = cash.add(position.multiply(lastClose));

        return SimulationResult.builder()
                .trades(Collections.unmodifiableList(trades))
                .finalCash(cash)
                .finalPosition(position)
                .finalValue(finalValue)
                .build();
    }
}
