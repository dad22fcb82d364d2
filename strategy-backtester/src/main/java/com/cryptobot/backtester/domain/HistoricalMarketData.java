package com.cryptobot.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stored OHLCV bar. Persistent counterpart of {@link PriceBar}.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbol_bar_time", columnNames = { "symbol", "bar_time" })
}, indexes = {
        @Index(name = "idx_symbol_bar_time", columnList = "symbol, bar_time")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "bar_time", nullable = false)
    private Instant barTime;

    @Column(name = "open", nullable = false, precision = 20, scale = 8)
    private BigDecimal open;

    @Column(name = "high", nullable = false, precision = 20, scale = 8)
    private BigDecimal high;

    @Column(name = "low", nullable = false, precision = 20, scale = 8)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 20, scale = 8)
    private BigDecimal close;

    @Column(name = "volume", nullable = false)
    private Long volume;

    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .timestamp(this.barTime)
                .symbol(this.symbol)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .build();
    }

    /**
     * Missing open/high/low fall back to the close, missing volume to zero.
     */
    public static HistoricalMarketData fromPriceBar(PriceBar bar) {
        BigDecimal close = bar.getClose();
        return HistoricalMarketData.builder()
                .symbol(bar.getSymbol())
                .barTime(bar.getTimestamp())
                .open(bar.getOpen() != null ? bar.getOpen() : close)
                .high(bar.getHigh() != null ? bar.getHigh() : close)
                .low(bar.getLow() != null ? bar.getLow() : close)
                .close(close)
                .volume(bar.getVolume() != null ? bar.getVolume() : 0L)
                .build();
    }
}
