package com.cryptobot.backtester.config;

import com.cryptobot.backtester.exception.BacktestException;
import com.cryptobot.backtester.exception.InvalidDataException;
import com.cryptobot.backtester.exception.ParameterValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BacktestExceptionHandlerTest {

    private final BacktestExceptionHandler handler = new BacktestExceptionHandler();

    @Test
    void handleBadInput_invalidDataIsBadRequest() {
        ProblemDetail detail = handler.handleBadInput(new InvalidDataException("Bars must not be empty"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).isEqualTo("Bars must not be empty");
        assertThat(detail.getProperties()).containsEntry("code", "invalid_data");
    }

    @Test
    void handleBadInput_invalidParametersIsBadRequest() {
        ProblemDetail detail = handler.handleBadInput(new ParameterValidationException("Unknown strategy: turtle"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "invalid_parameters");
    }

    @Test
    void handleBacktestException_keepsCodeWithServerError() {
        ProblemDetail detail = handler.handleBacktestException(
                new BacktestException("serialization_failed", "Failed to serialize BACKTEST result"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getProperties()).containsEntry("code", "serialization_failed");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "strategyName", "Strategy name is required"));
        MethodParameter methodParameter = new MethodParameter(
                BacktestExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );
        MethodArgumentNotValidException exception = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ProblemDetail detail = handler.handleValidationException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).isEqualTo("Request validation failed");
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("Strategy name is required"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("At least one bar is required");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("At least one bar is required"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static class ValidationTarget {
        @SuppressWarnings("unused")
        private String strategyName;
    }
}
