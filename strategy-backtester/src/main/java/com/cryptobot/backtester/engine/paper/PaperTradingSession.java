package com.cryptobot.backtester.engine.paper;

import com.cryptobot.backtester.domain.EquityPoint;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.Signal;
import com.cryptobot.backtester.domain.SignaledBar;
import com.cryptobot.backtester.domain.strategy.Strategy;
import com.cryptobot.backtester.exception.InvalidDataException;
import com.cryptobot.backtester.risk.PortfolioRiskCalculator;
import com.cryptobot.backtester.risk.PositionDirection;
import com.cryptobot.backtester.risk.PositionSizer;
import com.cryptobot.backtester.risk.RiskCalculator;
import com.cryptobot.backtester.risk.RiskPosition;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays a strategy bar by bar against a {@link PaperPortfolio}, enforcing stop-loss and
 * take-profit levels before acting on the bar's signal. With a {@link PortfolioRiskCalculator}
 * present, new positions are shrunk to fit the remaining portfolio risk budget.
 */
@Slf4j
public class PaperTradingSession {

    private static final String DEFAULT_SYMBOL = "UNKNOWN";

    private final PaperTradingSettings settings;
    private final RiskCalculator riskCalculator;
    private final PositionSizer positionSizer;
    private final PortfolioRiskCalculator portfolioRiskCalculator;
    private final int scale;

    /**
     * @param portfolioRiskCalculator risk cap applied on entry; null disables the cap
     */
    public PaperTradingSession(PaperTradingSettings settings, RiskCalculator riskCalculator,
            PositionSizer positionSizer, PortfolioRiskCalculator portfolioRiskCalculator, int scale) {
        this.settings = settings;
        this.riskCalculator = riskCalculator;
        this.positionSizer = positionSizer;
        this.portfolioRiskCalculator = portfolioRiskCalculator;
        this.scale = scale;
    }

    public PaperTradingSession(PaperTradingSettings settings) {
        this(settings, new RiskCalculator(), new PositionSizer(), null, 10);
    }

    public PaperTradingResult run(Strategy strategy, List<PriceBar> bars) {
        log.info("Starting paper trading session - Strategy: {}, Bars: {}", strategy.getName(),
                bars == null ? 0 : bars.size());

        List<SignaledBar> signaled = strategy.generateSignals(bars);
        PaperPortfolio portfolio = new PaperPortfolio(settings.getInitialCapital(), scale);
        List<EquityPoint> equityCurve = new ArrayList<>(signaled.size());

        for (SignaledBar bar : signaled) {
            String symbol = symbolOf(bar.getBar());
            BigDecimal price = bar.getClose();
            if (price == null || price.signum() <= 0) {
                throw new InvalidDataException("Non-positive close " + price + " at " + bar.getTimestamp());
            }

            if (portfolio.hasPosition(symbol)) {
                manageOpenPosition(portfolio, symbol, bar);
            }

            if (bar.getSignal() == Signal.BUY && !portfolio.hasPosition(symbol)) {
                openPosition(portfolio, symbol, bar);
            }

            equityCurve.add(new EquityPoint(bar.getTimestamp(), portfolio.getPortfolioValue(symbol, price)));
        }

        if (!signaled.isEmpty()) {
            SignaledBar last = signaled.get(signaled.size() - 1);
            for (String symbol : new ArrayList<>(portfolio.getPositions().keySet())) {
                portfolio.closePosition(symbol, last.getClose(), CloseReason.END_OF_SESSION, last.getTimestamp());
            }
        }

        BigDecimal finalValue = portfolio.getCash();
        BigDecimal totalReturn = finalValue.subtract(settings.getInitialCapital());
        BigDecimal totalReturnPct = totalReturn.multiply(BigDecimal.valueOf(100))
                .divide(settings.getInitialCapital(), 4, RoundingMode.HALF_UP);

        log.info("Paper trading session complete - Final value: {}, Return: {}%, Trades: {}",
                finalValue.setScale(2, RoundingMode.HALF_UP), totalReturnPct, portfolio.getTotalTrades());

        return PaperTradingResult.builder()
                .strategyName(strategy.getName())
                .portfolio(portfolio)
                .equityCurve(equityCurve)
                .finalValue(finalValue)
                .totalReturn(totalReturn)
                .totalReturnPct(totalReturnPct)
                .winRate(portfolio.getWinRate())
                .build();
    }

    private void openPosition(PaperPortfolio portfolio, String symbol, SignaledBar bar) {
        BigDecimal price = bar.getClose();
        BigDecimal stopLoss = riskCalculator.stopLoss(price, settings.getStopLossPct(), PositionDirection.LONG);
        BigDecimal takeProfit = riskCalculator.takeProfit(price, settings.getTakeProfitPct(), PositionDirection.LONG);

        BigDecimal quantity = positionNotional(portfolio).divide(price, scale, RoundingMode.DOWN);
        if (portfolioRiskCalculator != null) {
            quantity = fitToRiskBudget(portfolio, symbol, price, price.subtract(stopLoss), quantity);
        }
        if (quantity.signum() <= 0) {
            log.warn("No risk budget left for {}, skipping BUY at {}", symbol, bar.getTimestamp());
            return;
        }
        portfolio.openPosition(symbol, quantity, price, stopLoss, takeProfit, bar.getTimestamp());
    }

    private BigDecimal positionNotional(PaperPortfolio portfolio) {
        BigDecimal cash = portfolio.getCash();
        if (settings.getSizingMethod() != SizingMethod.KELLY) {
            return positionSizer.fixedFraction(cash, settings.getPositionSizeFraction());
        }

        List<ClosedPosition> closed = portfolio.getClosedPositions();
        BigDecimal grossWin = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        int wins = 0;
        for (ClosedPosition position : closed) {
            if (position.getProfit().signum() > 0) {
                grossWin = grossWin.add(position.getProfit());
                wins++;
            } else {
                grossLoss = grossLoss.add(position.getProfit().abs());
            }
        }
        int losses = closed.size() - wins;
        BigDecimal winRate = closed.isEmpty() ? null
                : BigDecimal.valueOf(wins).divide(BigDecimal.valueOf(closed.size()), scale, RoundingMode.HALF_UP);
        BigDecimal avgWin = wins == 0 ? null
                : grossWin.divide(BigDecimal.valueOf(wins), scale, RoundingMode.HALF_UP);
        BigDecimal avgLoss = losses == 0 ? null
                : grossLoss.divide(BigDecimal.valueOf(losses), scale, RoundingMode.HALF_UP);
        return positionSizer.kelly(cash, winRate, avgWin, avgLoss).min(cash);
    }

    private BigDecimal fitToRiskBudget(PaperPortfolio portfolio, String symbol, BigDecimal price,
            BigDecimal riskPerUnit, BigDecimal quantity) {
        BigDecimal capital = portfolio.getPortfolioValue(symbol, price);
        List<RiskPosition> open = new ArrayList<>();
        for (Position position : portfolio.getPositions().values()) {
            BigDecimal stopDistance = position.getStopLoss() == null ? position.getEntryPrice()
                    : position.getEntryPrice().subtract(position.getStopLoss()).max(BigDecimal.ZERO);
            open.add(RiskPosition.builder()
                    .symbol(position.getSymbol())
                    .positionValue(position.getCurrentValue())
                    .riskAmount(position.getQuantity().multiply(stopDistance))
                    .build());
        }
        RiskPosition proposed = RiskPosition.builder()
                .symbol(symbol)
                .positionValue(quantity.multiply(price))
                .riskAmount(quantity.multiply(riskPerUnit))
                .build();
        if (portfolioRiskCalculator.isWithinLimits(proposed, open, capital)) {
            return quantity;
        }
        if (riskPerUnit.signum() <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal budget = portfolioRiskCalculator.maxPositionSize(capital, open);
        BigDecimal capped = budget.divide(riskPerUnit, scale, RoundingMode.DOWN).min(quantity);
        log.warn("Position for {} reduced from {} to {} units to stay within {} portfolio risk",
                symbol, quantity, capped, portfolioRiskCalculator.getMaxPortfolioRisk());
        return capped;
    }

    private void manageOpenPosition(PaperPortfolio portfolio, String symbol, SignaledBar bar) {
        BigDecimal price = bar.getClose();
        portfolio.markToMarket(symbol, price);
        Position position = portfolio.getPositions().get(symbol);

        if (settings.getTrailingStopPct() != null && position.getStopLoss() != null) {
            position.setStopLoss(riskCalculator.trailingStop(
                    price, position.getStopLoss(), settings.getTrailingStopPct(), PositionDirection.LONG));
        }

        if (position.getStopLoss() != null
                && riskCalculator.isStopLossHit(price, position.getStopLoss(), PositionDirection.LONG)) {
            portfolio.closePosition(symbol, price, CloseReason.STOP_LOSS, bar.getTimestamp());
        } else if (position.getTakeProfit() != null
                && riskCalculator.isTakeProfitHit(price, position.getTakeProfit(), PositionDirection.LONG)) {
            portfolio.closePosition(symbol, price, CloseReason.TAKE_PROFIT, bar.getTimestamp());
        } else if (bar.getSignal() == Signal.SELL) {
            portfolio.closePosition(symbol, price, CloseReason.SIGNAL, bar.getTimestamp());
        }
    }

    private static String symbolOf(PriceBar bar) {
        return bar.getSymbol() == null ? DEFAULT_SYMBOL : bar.getSymbol();
    }
}
