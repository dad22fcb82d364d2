package com.cryptobot.backtester.risk;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Stop-loss, take-profit and trailing stop levels for a single position.
 */
@Slf4j
public class RiskCalculator {

    private final int scale;

    public RiskCalculator(int scale) {
        this.scale = scale;
    }

    public RiskCalculator() {
        this(10);
    }

    public BigDecimal stopLoss(BigDecimal entryPrice, BigDecimal stopPct, PositionDirection direction) {
        BigDecimal stop = direction == PositionDirection.LONG
                ? entryPrice.multiply(BigDecimal.ONE.subtract(stopPct))
                : entryPrice.multiply(BigDecimal.ONE.add(stopPct));
        log.debug("Stop-loss: {} for entry: {} {}", stop, entryPrice, direction);
        return stop;
    }

    public BigDecimal takeProfit(BigDecimal entryPrice, BigDecimal profitPct, PositionDirection direction) {
        BigDecimal target = direction == PositionDirection.LONG
                ? entryPrice.multiply(BigDecimal.ONE.add(profitPct))
                : entryPrice.multiply(BigDecimal.ONE.subtract(profitPct));
        log.debug("Take-profit: {} for entry: {} {}", target, entryPrice, direction);
        return target;
    }

    /**
     * Reward per unit of risk.
     *
     * @return empty when the stop sits at the entry price
     */
    public Optional<BigDecimal> riskRewardRatio(BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal takeProfit) {
        BigDecimal risk = entryPrice.subtract(stopLoss).abs();
        BigDecimal reward = takeProfit.subtract(entryPrice).abs();
        if (risk.signum() == 0) {
            log.warn("Risk is zero, cannot calculate R:R ratio");
            return Optional.empty();
        }
        BigDecimal ratio = reward.divide(risk, scale, RoundingMode.HALF_UP);
        log.debug("Risk-Reward Ratio: {}:1", ratio.setScale(2, RoundingMode.HALF_UP));
        return Optional.of(ratio);
    }

    public boolean isStopLossHit(BigDecimal currentPrice, BigDecimal stopLoss, PositionDirection direction) {
        boolean hit = direction == PositionDirection.LONG
                ? currentPrice.compareTo(stopLoss) <= 0
                : currentPrice.compareTo(stopLoss) >= 0;
        if (hit) {
            log.info("STOP-LOSS HIT: {} vs {}", currentPrice, stopLoss);
        }
        return hit;
    }

    public boolean isTakeProfitHit(BigDecimal currentPrice, BigDecimal takeProfit, PositionDirection direction) {
        boolean hit = direction == PositionDirection.LONG
                ? currentPrice.compareTo(takeProfit) >= 0
                : currentPrice.compareTo(takeProfit) <= 0;
        if (hit) {
            log.info("TAKE-PROFIT HIT: {} vs {}", currentPrice, takeProfit);
        }
        return hit;
    }

    /**
     * Move the stop toward the price. A LONG stop only moves up, a SHORT stop only moves down.
     */
    public BigDecimal trailingStop(BigDecimal currentPrice, BigDecimal currentStop, BigDecimal trailPct,
            PositionDirection direction) {
        BigDecimal newStop = direction == PositionDirection.LONG
                ? currentPrice.multiply(BigDecimal.ONE.subtract(trailPct)).max(currentStop)
                : currentPrice.multiply(BigDecimal.ONE.add(trailPct)).min(currentStop);
        if (newStop.compareTo(currentStop) != 0) {
            log.info("Trailing stop updated: {} -> {}", currentStop, newStop);
        }
        return newStop;
    }
}
