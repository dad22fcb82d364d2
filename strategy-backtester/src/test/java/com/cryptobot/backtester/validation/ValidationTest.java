package com.cryptobot.backtester.validation;

import com.cryptobot.backtester.TestData;
import com.cryptobot.backtester.controller.dto.BacktestRequest;
import com.cryptobot.backtester.controller.dto.ComparisonRequest;
import com.cryptobot.backtester.controller.dto.StrategySpec;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Test
    void testValidRequest_NoViolations() {
        // Arrange
        BacktestRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testInlineBarsWithoutRange_NoViolations() {
        BacktestRequest request = BacktestRequest.builder()
                .strategyName("buy_and_hold")
                .bars(TestData.bars(100, 101))
                .build();

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testMissingStrategyName_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setStrategyName(" ");

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        ConstraintViolation<BacktestRequest> violation = violations.iterator().next();
        assertEquals("strategyName", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testMissingMarketData_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setEndDate(null);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("marketDataSpecified", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testNonPositiveCapital_Violation() {
        BacktestRequest request = createValidRequest();
        request.setInitialCapital(BigDecimal.ZERO);

        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertEquals("initialCapital", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testNegativeCosts_Violations() {
        BacktestRequest request = createValidRequest();
        request.setCommission(new BigDecimal("-0.001"));
        request.setSlippage(new BigDecimal("-0.001"));

        assertEquals(2, validator.validate(request).size());
    }

    @Test
    void testPositionSizeBounds_Violation() {
        BacktestRequest request = createValidRequest();

        request.setPositionSize(BigDecimal.ZERO);
        assertEquals(1, validator.validate(request).size());

        request.setPositionSize(BigDecimal.ONE);
        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testComparisonStrategySpecsValidated() {
        ComparisonRequest request = ComparisonRequest.builder()
                .bars(TestData.bars(100, 101))
                .strategies(List.of(StrategySpec.builder().strategyName("").build()))
                .build();

        Set<ConstraintViolation<ComparisonRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertTrue(violations.iterator().next().getPropertyPath().toString().startsWith("strategies"));
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .strategyName("ma_crossover")
                .parameters(Map.of("fastPeriod", 10, "slowPeriod", 30))
                .symbol("BTC-USD")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .initialCapital(new BigDecimal("10000"))
                .build();
    }
}
