package com.cryptobot.backtester.repository;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.domain.BacktestRun;
import com.cryptobot.backtester.domain.HistoricalMarketData;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.domain.RunType;
import com.cryptobot.backtester.domain.StrategyComparison;
import com.cryptobot.backtester.domain.strategy.StrategyType;
import com.cryptobot.backtester.service.BacktestResultStore;
import com.cryptobot.backtester.service.MarketDataService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Persistence tests against the embedded H2 database.
 */
@DataJpaTest
class BacktestRunRepositoryTest {

    @Autowired
    private BacktestRunRepository backtestRunRepository;

    @Autowired
    private HistoricalMarketDataRepository historicalMarketDataRepository;

    private BacktestResultStore resultStore;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        resultStore = new BacktestResultStore(backtestRunRepository, objectMapper);
    }

    @Test
    void testFindByStrategyName_NewestFirst() {
        // Arrange
        backtestRunRepository.save(createRun("BuyAndHold", LocalDateTime.of(2024, 1, 1, 9, 0)));
        backtestRunRepository.save(createRun("BuyAndHold", LocalDateTime.of(2024, 3, 1, 9, 0)));
        backtestRunRepository.save(createRun("RsiMeanReversion(14,30.0,70.0)", LocalDateTime.of(2024, 2, 1, 9, 0)));

        // Act
        List<BacktestRun> runs = backtestRunRepository.findByStrategyNameOrderByCreatedAtDesc("BuyAndHold");

        // Assert
        assertEquals(2, runs.size());
        assertEquals(LocalDateTime.of(2024, 3, 1, 9, 0), runs.get(0).getCreatedAt());
        assertEquals(LocalDateTime.of(2024, 1, 1, 9, 0), runs.get(1).getCreatedAt());
    }

    @Test
    void testStoreSavesJsonPayload() {
        // Arrange
        StrategyComparison row = StrategyComparison.builder()
                .strategyName("BuyAndHold")
                .totalReturnPct(new BigDecimal("4.2000"))
                .numTrades(1)
                .build();

        // Act
        BacktestRun saved = resultStore.save(RunType.COMPARISON, null, "BuyAndHold", TestData.SYMBOL, List.of(row),
                row.getTotalReturnPct(), null, null, null);

        // Assert
        assertNotNull(saved.getId());
        BacktestRun loaded = backtestRunRepository.findById(saved.getId()).orElseThrow();
        assertEquals(RunType.COMPARISON, loaded.getRunType());
        assertTrue(loaded.getResultJson().contains("\"strategyName\":\"BuyAndHold\""));
        assertNull(loaded.getStrategyKey());
        assertEquals(1, resultStore.findRuns(null).size());
    }

    @Test
    void testFindRuns_ByTypeAliasMatchesEveryParameterization() {
        // Arrange
        resultStore.save(RunType.BACKTEST, StrategyType.MA_CROSSOVER, "MovingAverageCrossover(5,20,SMA)",
                TestData.SYMBOL, "{}", new BigDecimal("1.0000"), null, null, null);
        resultStore.save(RunType.BACKTEST, StrategyType.MA_CROSSOVER, "MovingAverageCrossover(10,50,EMA)",
                TestData.SYMBOL, "{}", new BigDecimal("2.0000"), null, null, null);
        resultStore.save(RunType.BACKTEST, StrategyType.BUY_AND_HOLD, "BuyAndHold",
                TestData.SYMBOL, "{}", new BigDecimal("3.0000"), null, null, null);

        // Act
        List<BacktestRun> byAlias = resultStore.findRuns("ma_crossover");
        List<BacktestRun> byDisplayName = resultStore.findRuns("MovingAverageCrossover(5,20,SMA)");
        List<BacktestRun> unknown = resultStore.findRuns("turtle");

        // Assert
        assertEquals(2, byAlias.size());
        assertTrue(byAlias.stream().allMatch(run -> run.getStrategyKey() == StrategyType.MA_CROSSOVER));
        assertEquals(1, byDisplayName.size());
        assertTrue(unknown.isEmpty());
    }

    @Test
    void testIngestedBarsLoadInOrder() {
        // Arrange
        MarketDataService marketDataService = new MarketDataService(historicalMarketDataRepository);
        List<PriceBar> bars = TestData.bars(100, 101, 102);

        // Act
        int inserted = marketDataService.storeBars(TestData.SYMBOL, List.of(bars.get(2), bars.get(0), bars.get(1)));
        int again = marketDataService.storeBars(TestData.SYMBOL, bars);
        List<PriceBar> loaded = marketDataService.loadMarketData(TestData.SYMBOL,
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));

        // Assert
        assertEquals(3, inserted);
        assertEquals(0, again);
        assertEquals(2, loaded.size());
        assertEquals(TestData.day(0), loaded.get(0).getTimestamp());
        assertEquals(0, new BigDecimal("101").compareTo(loaded.get(1).getClose()));
        assertTrue(historicalMarketDataRepository.existsBySymbolAndBarTime(TestData.SYMBOL, TestData.day(2)));
    }

    private BacktestRun createRun(String strategyName, LocalDateTime createdAt) {
        return BacktestRun.builder()
                .runType(RunType.BACKTEST)
                .strategyName(strategyName)
                .symbol(TestData.SYMBOL)
                .createdAt(createdAt)
                .totalReturnPct(new BigDecimal("1.2500"))
                .resultJson("{}")
                .build();
    }
}
