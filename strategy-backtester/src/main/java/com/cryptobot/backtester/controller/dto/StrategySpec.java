package com.cryptobot.backtester.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategySpec {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();
}
