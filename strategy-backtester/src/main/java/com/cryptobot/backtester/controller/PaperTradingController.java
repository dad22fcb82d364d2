package com.cryptobot.backtester.controller;

import com.cryptobot.backtester.controller.dto.PaperTradingRequest;
import com.cryptobot.backtester.controller.dto.PaperTradingResponse;
import com.cryptobot.backtester.service.PaperTradingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for paper-trading sessions.
 */
@RestController
@RequestMapping("/paper-sessions")
@RequiredArgsConstructor
@Slf4j
public class PaperTradingController {

    private final PaperTradingService paperTradingService;

    @PostMapping
    public ResponseEntity<PaperTradingResponse> runSession(@Valid @RequestBody PaperTradingRequest request) {

        log.info("POST /paper-sessions - Strategy: {}, Symbol: {}",
                request.getStrategyName(), request.getSymbol());

        return ResponseEntity.status(HttpStatus.CREATED).body(paperTradingService.runSession(request));
    }
}
