package com.cryptobot.backtester.repository;

import com.cryptobot.backtester.domain.HistoricalMarketData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for accessing historical market data from the database.
 */
@Repository
public interface HistoricalMarketDataRepository extends JpaRepository<HistoricalMarketData, Long> {

    /**
     * Find bars for a symbol with {@code from <= barTime < to}, oldest first.
     */
    @Query("SELECT h FROM HistoricalMarketData h WHERE h.symbol = :symbol " +
            "AND h.barTime >= :from AND h.barTime < :to ORDER BY h.barTime ASC")
    List<HistoricalMarketData> findBySymbolAndTimeRange(
            @Param("symbol") String symbol,
            @Param("from") Instant from,
            @Param("to") Instant to);

    boolean existsBySymbolAndBarTime(String symbol, Instant barTime);
}
