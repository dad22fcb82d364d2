package com.cryptobot.backtester.service;

import com.cryptobot.backtester.domain.HistoricalMarketData;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.exception.InvalidDataException;
import com.cryptobot.backtester.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Service for loading market data.
 * Loads daily bars from the database and falls back to a deterministic
 * synthetic random walk when no stored bars exist for the range.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private static final long SYNTHETIC_SEED = 42L;

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    /**
     * Use the supplied bars when there are any, otherwise load the range.
     */
    @Transactional(readOnly = true)
    public List<PriceBar> resolveBars(List<PriceBar> bars, String symbol, LocalDate startDate, LocalDate endDate) {
        if (bars != null && !bars.isEmpty()) {
            log.info("Using {} bars supplied with the request", bars.size());
            return bars;
        }
        return loadMarketData(symbol, startDate, endDate);
    }

    /**
     * Load bars for {@code symbol} between the two dates, both inclusive, oldest first.
     */
    @Transactional(readOnly = true)
    public List<PriceBar> loadMarketData(String symbol, LocalDate startDate, LocalDate endDate) {
        if (symbol == null || startDate == null || endDate == null) {
            throw new InvalidDataException("Symbol, start date and end date are required when no bars are supplied");
        }
        if (endDate.isBefore(startDate)) {
            throw new InvalidDataException("End date " + endDate + " is before start date " + startDate);
        }

        log.info("Loading market data for {} from {} to {}", symbol, startDate, endDate);

        List<HistoricalMarketData> historicalData = historicalMarketDataRepository.findBySymbolAndTimeRange(
                symbol,
                startDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());

        if (!historicalData.isEmpty()) {
            log.info("Loaded {} historical bars for {} from database", historicalData.size(), symbol);
            return historicalData.stream()
                    .map(HistoricalMarketData::toPriceBar)
                    .collect(Collectors.toList());
        }

        log.warn("No historical data found for {}. Generating synthetic data.", symbol);
        List<PriceBar> syntheticData = generateSyntheticData(symbol, startDate, endDate);

        log.info("Generated {} synthetic bars for {}", syntheticData.size(), symbol);
        return syntheticData;
    }

    /**
     * Store bars for {@code symbol}, skipping timestamps already present.
     *
     * @return number of bars inserted
     */
    @Transactional
    public int storeBars(String symbol, List<PriceBar> bars) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidDataException("Symbol is required");
        }
        log.info("Starting ingestion of {} bars for {}", bars.size(), symbol);

        List<HistoricalMarketData> toInsert = new ArrayList<>();
        int duplicates = 0;
        for (PriceBar bar : bars) {
            if (bar.getTimestamp() == null || bar.getClose() == null) {
                throw new InvalidDataException("Bars must carry a timestamp and a close price");
            }
            if (bar.getClose().signum() <= 0) {
                throw new InvalidDataException("Close price must be positive, got " + bar.getClose()
                        + " at " + bar.getTimestamp());
            }
            if (historicalMarketDataRepository.existsBySymbolAndBarTime(symbol, bar.getTimestamp())) {
                duplicates++;
                continue;
            }
            toInsert.add(HistoricalMarketData.fromPriceBar(bar.toBuilder().symbol(symbol).build()));
        }

        historicalMarketDataRepository.saveAll(toInsert);
        log.info("Ingestion completed for {}: {} inserted, {} duplicates skipped", symbol, toInsert.size(), duplicates);
        return toInsert.size();
    }

    /**
     * Random walk with drift, one bar per calendar day. The fixed seed makes repeated
     * loads of the same range identical.
     */
    private List<PriceBar> generateSyntheticData(String symbol, LocalDate startDate, LocalDate endDate) {
        List<PriceBar> data = new ArrayList<>();
        Random random = new Random(SYNTHETIC_SEED);

        BigDecimal basePrice = new BigDecimal("100.00");
        LocalDate currentDate = startDate;

        while (!currentDate.isAfter(endDate)) {
            double changePercent = (random.nextGaussian() * 0.02) + 0.0003;
            basePrice = basePrice.add(basePrice.multiply(BigDecimal.valueOf(changePercent)));

            if (basePrice.compareTo(BigDecimal.ONE) < 0) {
                basePrice = BigDecimal.ONE;
            }

            BigDecimal open = basePrice;
            BigDecimal close = basePrice.multiply(BigDecimal.valueOf(1 + (random.nextGaussian() * 0.005)));
            BigDecimal high = open.max(close)
                    .multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.01));
            BigDecimal low = open.min(close)
                    .multiply(BigDecimal.valueOf(1 - Math.abs(random.nextGaussian()) * 0.01));

            data.add(PriceBar.builder()
                    .timestamp(currentDate.atStartOfDay(ZoneOffset.UTC).toInstant())
                    .symbol(symbol)
                    .open(open.setScale(2, RoundingMode.HALF_UP))
                    .high(high.setScale(2, RoundingMode.HALF_UP))
                    .low(low.setScale(2, RoundingMode.HALF_UP))
                    .close(close.setScale(2, RoundingMode.HALF_UP))
                    .volume((long) (1000000 + random.nextInt(500000)))
                    .build());

            currentDate = currentDate.plusDays(1);
        }

        return data;
    }
}
