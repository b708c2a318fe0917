package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentValidatorTest {

    private static final String PATH = "path";
    private static final String COUNT = "count";

    private ToolArgumentValidator validator;
    private ToolDefinition definition;

    @BeforeEach
    void setUp() {
        validator = new ToolArgumentValidator();
        definition = ToolDefinition.builder()
                .name("sample")
                .description("Sample tool")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PATH, Map.of("type", "string"),
                                COUNT, Map.of("type", "integer"),
                                "verbose", Map.of("type", "boolean"),
                                "tags", Map.of("type", "array")),
                        "required", List.of(PATH)))
                .build();
    }

    @Test
    void shouldAcceptValidArguments() {
        Optional<String> result = validator.validate(definition, Map.of(PATH, "a.txt", COUNT, 3));

        assertTrue(result.isEmpty());
    }

    @Test
    void shouldReportMissingRequiredParameter() {
        Optional<String> result = validator.validate(definition, Map.of(COUNT, 3));

        assertEquals(Optional.of("Missing required parameter: path"), result);
    }

    @Test
    void shouldTreatNullValueAsMissing() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(PATH, null);

        assertEquals(Optional.of("Missing required parameter: path"), validator.validate(definition, arguments));
    }

    @Test
    void shouldReportTypeMismatchOfRequiredParameter() {
        Optional<String> result = validator.validate(definition, Map.of(PATH, 42));

        assertEquals(Optional.of("Parameter 'path' must be of type string"), result);
    }

    @Test
    void shouldReportTypeMismatchOfOptionalParameter() {
        Optional<String> result = validator.validate(definition, Map.of(PATH, "a.txt", "verbose", "yes"));

        assertEquals(Optional.of("Parameter 'verbose' must be of type boolean"), result);
    }

    @Test
    void shouldAcceptIntegralNumbersFromJson() {
        assertTrue(validator.validate(definition, Map.of(PATH, "a", COUNT, 5.0d)).isEmpty());
        assertTrue(validator.validate(definition, Map.of(PATH, "a", COUNT, new BigDecimal("7"))).isEmpty());
        assertTrue(validator.validate(definition, Map.of(PATH, "a", COUNT, 9L)).isEmpty());
    }

    @Test
    void shouldRejectFractionalInteger() {
        Optional<String> result = validator.validate(definition, Map.of(PATH, "a", COUNT, 1.5d));

        assertEquals(Optional.of("Parameter 'count' must be of type integer"), result);
    }

    @Test
    void shouldIgnoreUndeclaredParameters() {
        assertTrue(validator.validate(definition, Map.of(PATH, "a", "extra", new Object())).isEmpty());
    }

    @Test
    void shouldAcceptArraysAndLists() {
        assertTrue(validator.validate(definition, Map.of(PATH, "a", "tags", List.of("x"))).isEmpty());
        assertTrue(validator.validate(definition, Map.of(PATH, "a", "tags", new String[] { "x" })).isEmpty());
    }

    @Test
    void shouldAcceptAnythingForSchemaWithoutProperties() {
        ToolDefinition simple = ToolDefinition.simple("ping", "Ping");

        assertTrue(validator.validate(simple, Map.of("anything", 1)).isEmpty());
    }

    @Test
    void shouldMatchJsonTypes() {
        assertTrue(ToolArgumentValidator.matchesType("number", 1.25));
        assertTrue(ToolArgumentValidator.matchesType("object", Map.of()));
        assertFalse(ToolArgumentValidator.matchesType("object", "text"));
        assertFalse(ToolArgumentValidator.matchesType("integer", Double.POSITIVE_INFINITY));
        assertTrue(ToolArgumentValidator.matchesType("custom", "whatever"));
    }
}
