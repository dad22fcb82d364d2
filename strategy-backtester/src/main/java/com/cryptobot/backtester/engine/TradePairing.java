package com.cryptobot.backtester.engine;

import com.cryptobot.backtester.domain.Trade;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches each SELL with the earliest unmatched BUY of the same symbol.
 * Unmatched BUYs (an open position) and SELLs without a prior BUY are left out.
 */
public final class TradePairing {

    private TradePairing() {} // Utility class

    public static List<CompletedTrade> pair(List<Trade> trades) {
        Map<String, Deque<Trade>> openBuys = new HashMap<>();
        List<CompletedTrade> completed = new ArrayList<>();

        for (Trade trade : trades) {
            Deque<Trade> queue = openBuys.computeIfAbsent(String.valueOf(trade.getSymbol()), s -> new ArrayDeque<>());
            if (trade.getType() == Trade.TradeType.BUY) {
                queue.addLast(trade);
            } else if (!queue.isEmpty()) {
                Trade buy = queue.removeFirst();
                completed.add(CompletedTrade.builder()
                        .symbol(buy.getSymbol())
                        .entryTime(buy.getTimestamp())
                        .exitTime(trade.getTimestamp())
                        .entryPrice(buy.getPrice())
                        .exitPrice(trade.getPrice())
                        .quantity(buy.getQuantity())
                        .profit(trade.getPrice().subtract(buy.getPrice()).multiply(buy.getQuantity()))
                        .build());
            }
        }
        return completed;
    }
}
