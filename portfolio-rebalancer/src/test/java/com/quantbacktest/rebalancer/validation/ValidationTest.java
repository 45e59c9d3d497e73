package com.quantbacktest.rebalancer.validation;

import com.quantbacktest.rebalancer.controller.dto.SimulationRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

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
        SimulationRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testOptionalFieldsMayBeAbsent() {
        SimulationRequest request = createValidRequest();
        request.setFrequency(null);
        request.setMaxPositions(null);
        request.setParameters(null);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testMissingStrategyName_Violation() {
        // Arrange
        SimulationRequest request = createValidRequest();
        request.setStrategyName(null);

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        ConstraintViolation<SimulationRequest> violation = violations.iterator().next();
        assertEquals("strategyName", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testMissingDates_Violations() {
        SimulationRequest request = createValidRequest();
        request.setStartDate(null);
        request.setEndDate(null);

        Set<String> fields = validator.validate(request).stream()
                .map(v -> v.getPropertyPath().toString())
                .collect(Collectors.toSet());

        assertEquals(Set.of("startDate", "endDate"), fields);
    }

    @Test
    void testNonPositiveCapital_Violation() {
        SimulationRequest request = createValidRequest();
        request.setInitialCapital(BigDecimal.ZERO);

        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertEquals("Initial capital must be positive", violations.iterator().next().getMessage());
    }

    @Test
    void testNonPositiveMaxPositions_Violation() {
        SimulationRequest request = createValidRequest();
        request.setMaxPositions(0);

        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertEquals("maxPositions", violations.iterator().next().getPropertyPath().toString());
    }

    private SimulationRequest createValidRequest() {
        return SimulationRequest.builder()
                .strategyName("momentum")
                .startDate(LocalDate.of(2021, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .initialCapital(new BigDecimal("1000000"))
                .maxPositions(6)
                .parameters(Map.of("maxRsi", 70))
                .build();
    }
}
