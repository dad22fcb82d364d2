package com.cryptobot.backtester.controller;

import com.cryptobot.backtester.controller.dto.MarketDataIngestionResponse;
import com.cryptobot.backtester.domain.PriceBar;
import com.cryptobot.backtester.service.MarketDataService;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for loading historical bars into the database.
 */
@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Validated
@Slf4j
public class MarketDataController {

    private final MarketDataService marketDataService;

    /**
     * Store bars for a symbol. Bars whose timestamp is already stored are skipped.
     *
     * @param symbol the symbol the bars belong to
     * @param bars   bars in any order
     * @return received and inserted counts
     */
    @PostMapping("/{symbol}/bars")
    public ResponseEntity<MarketDataIngestionResponse> ingestBars(
            @PathVariable String symbol,
            @RequestBody @NotEmpty(message = "At least one bar is required") List<PriceBar> bars) {

        log.info("POST /market-data/{}/bars - Bars: {}", symbol, bars.size());

        int inserted = marketDataService.storeBars(symbol, bars);

        return ResponseEntity.status(HttpStatus.CREATED).body(MarketDataIngestionResponse.builder()
                .symbol(symbol)
                .received(bars.size())
                .inserted(inserted)
                .build());
    }
}
