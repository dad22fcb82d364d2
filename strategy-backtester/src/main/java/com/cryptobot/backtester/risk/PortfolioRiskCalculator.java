package com.cryptobot.backtester.risk;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregate risk across open positions, with additive caps on total risk.
 */
@Slf4j
public class PortfolioRiskCalculator {

    public static final BigDecimal DEFAULT_MAX_PORTFOLIO_RISK = new BigDecimal("0.10");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int scale;
    private final BigDecimal maxPortfolioRisk;

    public PortfolioRiskCalculator(int scale, BigDecimal maxPortfolioRisk) {
        this.scale = scale;
        this.maxPortfolioRisk = maxPortfolioRisk;
    }

    public PortfolioRiskCalculator() {
        this(10, DEFAULT_MAX_PORTFOLIO_RISK);
    }

    public BigDecimal getMaxPortfolioRisk() {
        return maxPortfolioRisk;
    }

    /**
     * Sum exposure and risk over the positions. With non-positive capital the
     * percentage and leverage figures are reported as zero.
     */
    public PortfolioRisk calculate(Collection<RiskPosition> positions, BigDecimal totalCapital) {
        if (positions == null || positions.isEmpty()) {
            return PortfolioRisk.EMPTY;
        }

        BigDecimal totalExposure = positions.stream()
                .map(RiskPosition::getPositionValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalRisk = positions.stream()
                .map(RiskPosition::getRiskAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal riskPct = BigDecimal.ZERO;
        BigDecimal leverage = BigDecimal.ZERO;
        if (isPositive(totalCapital)) {
            riskPct = totalRisk.divide(totalCapital, scale, RoundingMode.HALF_UP).multiply(HUNDRED);
            leverage = totalExposure.divide(totalCapital, scale, RoundingMode.HALF_UP);
        } else {
            log.warn("Cannot express portfolio risk relative to capital {}", totalCapital);
        }

        log.info("Portfolio Risk: {}% Positions: {} Leverage: {}x",
                riskPct.setScale(2, RoundingMode.HALF_UP), positions.size(),
                leverage.setScale(2, RoundingMode.HALF_UP));

        return PortfolioRisk.builder()
                .totalExposure(totalExposure)
                .totalRisk(totalRisk)
                .portfolioRiskPct(riskPct)
                .numPositions(positions.size())
                .leverage(leverage)
                .build();
    }

    /**
     * Check whether adding {@code proposed} keeps aggregate risk at or below {@code maxRisk * 100} percent.
     * Non-positive capital never passes.
     */
    public boolean isWithinLimits(RiskPosition proposed, Collection<RiskPosition> current,
            BigDecimal capital, BigDecimal maxRisk) {
        if (!isPositive(capital)) {
            log.warn("Rejecting proposed position for {}: capital must be positive, got {}",
                    proposed.getSymbol(), capital);
            return false;
        }

        List<RiskPosition> all = new ArrayList<>(current);
        all.add(proposed);
        PortfolioRisk newRisk = calculate(all, capital);

        BigDecimal limit = maxRisk.multiply(HUNDRED);
        boolean withinLimits = newRisk.getPortfolioRiskPct().compareTo(limit) <= 0;
        if (!withinLimits) {
            log.warn("Risk limit exceeded: {}% > {}%",
                    newRisk.getPortfolioRiskPct().setScale(2, RoundingMode.HALF_UP), limit);
        }
        return withinLimits;
    }

    public boolean isWithinLimits(RiskPosition proposed, Collection<RiskPosition> current, BigDecimal capital) {
        return isWithinLimits(proposed, current, capital, maxPortfolioRisk);
    }

    /**
     * Remaining risk budget: {@code capital * max(0, maxPortfolioRisk - currentRiskPct / 100)}.
     */
    public BigDecimal maxPositionSize(BigDecimal capital, BigDecimal maxRisk, Collection<RiskPosition> current) {
        if (!isPositive(capital)) {
            log.warn("No position budget: capital must be positive, got {}", capital);
            return BigDecimal.ZERO;
        }

        PortfolioRisk currentRisk = calculate(current, capital);
        BigDecimal remaining = maxRisk
                .subtract(currentRisk.getPortfolioRiskPct().divide(HUNDRED, scale, RoundingMode.HALF_UP))
                .max(BigDecimal.ZERO);
        BigDecimal maxPosition = capital.multiply(remaining);
        log.debug("Max position size: {} Remaining risk: {}%", maxPosition, remaining.multiply(HUNDRED));
        return maxPosition;
    }

    public BigDecimal maxPositionSize(BigDecimal capital, Collection<RiskPosition> current) {
        return maxPositionSize(capital, maxPortfolioRisk, current);
    }

    private static boolean isPositive(BigDecimal capital) {
        return capital != null && capital.signum() > 0;
    }
}
