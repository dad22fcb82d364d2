package com.cryptobot.backtester.engine.paper;

import com.cryptobot.backtester.domain.EquityPoint;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a paper-trading session. All positions are closed, so the final value is cash.
 */
@Value
@Builder
public class PaperTradingResult {
    String strategyName;
    PaperPortfolio portfolio;
    List<EquityPoint> equityCurve;
    BigDecimal finalValue;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    BigDecimal winRate;
}
