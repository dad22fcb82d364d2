package com.cryptobot.backtester.risk;

import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.indicators.ATR;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Position sizing methods: fixed fraction, Kelly criterion and ATR-scaled.
 * Degenerate inputs fall back to a fixed 2 % of capital with a WARN.
 */
@Slf4j
public class PositionSizer {

    public static final BigDecimal FALLBACK_RISK_PCT = new BigDecimal("0.02");
    public static final BigDecimal DEFAULT_MAX_KELLY_FRACTION = new BigDecimal("0.5");
    public static final BigDecimal DEFAULT_ATR_MULTIPLIER = BigDecimal.valueOf(2);

    private final int scale;
    private final BigDecimal maxKellyFraction;

    public PositionSizer(int scale, BigDecimal maxKellyFraction) {
        this.scale = scale;
        this.maxKellyFraction = maxKellyFraction;
    }

    public PositionSizer() {
        this(10, DEFAULT_MAX_KELLY_FRACTION);
    }

    public BigDecimal fixedFraction(BigDecimal capital, BigDecimal riskPct) {
        BigDecimal size = capital.multiply(riskPct);
        log.debug("Fixed position size: {} for capital: {}", size, capital);
        return size;
    }

    /**
     * Kelly criterion sizing, {@code f = (p*b - q) / b} with {@code b = avgWin / avgLoss},
     * clamped to {@code [0, maxKellyFraction]}.
     *
     * @param winRate probability of a winning trade in [0, 1]; null is treated as unknown
     * @param avgLoss average losing trade as a positive amount
     */
    public BigDecimal kelly(BigDecimal capital, BigDecimal winRate, BigDecimal avgWin,
            BigDecimal avgLoss, BigDecimal maxFraction) {
        if (winRate == null || winRate.signum() == 0) {
            return kellyFallback(capital, "win rate is missing or zero");
        }
        if (avgLoss == null || avgLoss.signum() == 0) {
            return kellyFallback(capital, "average loss is zero");
        }
        if (avgWin == null || avgWin.signum() == 0) {
            return kellyFallback(capital, "average win is zero");
        }

        BigDecimal winLossRatio = avgWin.divide(avgLoss, scale, RoundingMode.HALF_UP);
        BigDecimal lossRate = BigDecimal.ONE.subtract(winRate);
        BigDecimal fraction = winRate.multiply(winLossRatio)
                .subtract(lossRate)
                .divide(winLossRatio, scale, RoundingMode.HALF_UP)
                .min(maxFraction)
                .max(BigDecimal.ZERO);
        BigDecimal size = capital.multiply(fraction);
        log.debug("Kelly position size: {} Kelly%: {}", size, fraction.movePointRight(2));
        return size;
    }

    /**
     * Kelly sizing capped at the configured maximum fraction.
     */
    public BigDecimal kelly(BigDecimal capital, BigDecimal winRate, BigDecimal avgWin, BigDecimal avgLoss) {
        return kelly(capital, winRate, avgWin, avgLoss, maxKellyFraction);
    }

    public BigDecimal getMaxKellyFraction() {
        return maxKellyFraction;
    }

    private BigDecimal kellyFallback(BigDecimal capital, String reason) {
        log.warn("Invalid parameters for Kelly Criterion ({}), using 2% fixed", reason);
        return capital.multiply(FALLBACK_RISK_PCT);
    }

    /**
     * Size a position so that a stop {@code atr * multiplier} below entry risks
     * {@code capital * riskPct}.
     */
    public AtrPositionSize atrBased(BigDecimal capital, BigDecimal riskPct, BigDecimal atr,
            BigDecimal price, BigDecimal multiplier) {
        BigDecimal riskAmount = capital.multiply(riskPct);
        BigDecimal stopDistance = atr.multiply(multiplier);
        if (stopDistance.signum() <= 0) {
            log.warn("ATR sizing not possible (stop distance is zero), using 2% fixed");
            BigDecimal positionValue = capital.multiply(FALLBACK_RISK_PCT);
            BigDecimal units = price.signum() > 0
                    ? positionValue.divide(price, scale, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            return AtrPositionSize.builder()
                    .units(units)
                    .positionValue(positionValue)
                    .stopDistance(BigDecimal.ZERO)
                    .build();
        }

        BigDecimal units = riskAmount.divide(stopDistance, scale, RoundingMode.HALF_UP);
        BigDecimal positionValue = units.multiply(price);
        log.debug("ATR position sizing: Units: {} Value: {} Stop: {}", units, positionValue, stopDistance);
        return AtrPositionSize.builder()
                .units(units)
                .positionValue(positionValue)
                .stopDistance(stopDistance)
                .build();
    }

    /**
     * ATR sizing from a bar series: uses the latest ATR value and the last close.
     */
    public AtrPositionSize atrBased(BigDecimal capital, BigDecimal riskPct, List<PriceBar> bars,
            int atrPeriod, BigDecimal multiplier) {
        double[] atr = ATR.calculate(bars, atrPeriod);
        double latest = atr.length == 0 ? Double.NaN : atr[atr.length - 1];
        BigDecimal price = bars.isEmpty() ? BigDecimal.ZERO : bars.get(bars.size() - 1).getClose();
        BigDecimal atrValue = Double.isNaN(latest) ? BigDecimal.ZERO : BigDecimal.valueOf(latest);
        return atrBased(capital, riskPct, atrValue, price, multiplier);
    }
}
