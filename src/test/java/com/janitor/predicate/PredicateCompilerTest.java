package com.janitor.predicate;

import com.janitor.exception.PredicateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for compiling and evaluating predicates against object documents.
 */
class PredicateCompilerTest {

    private Map<String, Object> deployment;

    @BeforeEach
    void setUp() {
        deployment = Map.of(
                "kind", "Deployment",
                "metadata", Map.of(
                        "name", "pr-42-web",
                        "namespace", "default",
                        "labels", Map.of("env", "test", "team", "payments"),
                        "annotations", Map.of("janitor/ttl", "1h")),
                "spec", Map.of(
                        "replicas", 3,
                        "template", Map.of(
                                "metadata", Map.of("labels", Map.of("app", "web")),
                                "spec", Map.of("containers", List.of(
                                        Map.of("name", "web", "image", "nginx:1.25"),
                                        Map.of("name", "sidecar", "image", "envoy:1.29"))))));
    }

    // =====================================================================
    // Matching
    // =====================================================================

    static Stream<Arguments> predicates() {
        return Stream.of(
                Arguments.of("metadata.labels.env == 'test'", true),
                Arguments.of("metadata.labels.env == 'prod'", false),
                Arguments.of("metadata.labels.env != 'prod'", true),
                Arguments.of("metadata.name", true),
                Arguments.of("metadata.missing", false),
                Arguments.of("!(spec.template.metadata.labels.application)", true),
                Arguments.of("!(spec.template.metadata.labels.app)", false),
                Arguments.of("starts_with(metadata.name, 'pr-')", true),
                Arguments.of("ends_with(metadata.name, '-api')", false),
                Arguments.of("contains(spec.template.spec.containers[*].name, 'sidecar')", true),
                Arguments.of("contains(spec.template.spec.containers[*].image, 'redis:7')", false),
                Arguments.of("spec.replicas > `2`", true),
                Arguments.of("spec.replicas >= 3 && spec.replicas <= 3", true),
                Arguments.of("spec.replicas < 1 || metadata.labels.team == 'payments'", true),
                Arguments.of("length(metadata.labels) == `2`", true),
                Arguments.of("metadata.annotations.\"janitor/ttl\" == '1h'", true),
                Arguments.of("spec.template.spec.containers[0].name == 'web'", true),
                Arguments.of("type(spec.replicas) == 'number'", true),
                Arguments.of("contains(keys(metadata.labels), 'team')", true),
                Arguments.of("not_null(metadata.missing, metadata.name) == 'pr-42-web'", true)
        );
    }

    @ParameterizedTest
    @DisplayName("Predicates evaluate against the document")
    @MethodSource("predicates")
    void evaluatesPredicates(String expression, boolean expected) {
        CompiledPredicate predicate = PredicateCompiler.compile(expression);

        assertEquals(expected, predicate.matches(deployment), expression);
    }

    @Test
    @DisplayName("Projections collect values from every element")
    void projectsLists() {
        Object result = PredicateCompiler.compile("spec.template.spec.containers[*].image").search(deployment);

        assertEquals(List.of("nginx:1.25", "envoy:1.29"), result);
    }

    @Test
    @DisplayName("Object projections collect values of every key")
    void projectsObjectValues() {
        Object result = PredicateCompiler.compile("metadata.labels.*").search(deployment);

        assertInstanceOf(List.class, result);
        assertTrue(((List<?>) result).containsAll(List.of("test", "payments")));
    }

    @Test
    @DisplayName("to_string renders non-string values as JSON")
    void toStringRendersJson() {
        assertEquals("[\"web\",\"sidecar\"]",
                PredicateCompiler.compile("to_string(spec.template.spec.containers[*].name)").search(deployment));
        assertEquals("{\"app\":\"web\"}",
                PredicateCompiler.compile("to_string(spec.template.metadata.labels)").search(deployment));
        assertEquals("3", PredicateCompiler.compile("to_string(spec.replicas)").search(deployment));
        assertEquals("pr-42-web", PredicateCompiler.compile("to_string(metadata.name)").search(deployment));
    }

    @Test
    @DisplayName("Numbers and null never count as a match")
    void numbersDoNotMatch() {
        assertEquals(3, ((Number) PredicateCompiler.compile("spec.replicas").search(deployment)).intValue());
        assertFalse(PredicateCompiler.compile("spec.replicas").matches(deployment));
        assertFalse(PredicateCompiler.compile("spec.missing").matches(deployment));
    }

    @Test
    @DisplayName("Context values are reachable under _context")
    void readsContext() {
        Map<String, Object> document = Map.of(
                PredicateSyntax.CONTEXT_KEY, Map.of("pvc_is_not_mounted", true, "pvc_is_not_referenced", false));

        assertTrue(PredicateCompiler.compile("_context.pvc_is_not_mounted").matches(document));
        assertFalse(PredicateCompiler.compile("_context.pvc_is_not_mounted && _context.pvc_is_not_referenced")
                .matches(document));
    }

    @Test
    @DisplayName("Type errors during evaluation do not match")
    void evaluationErrorIsNoMatch() {
        CompiledPredicate predicate = PredicateCompiler.compile("starts_with(spec.replicas, 'x')");

        assertThrows(PredicateException.class, () -> predicate.search(deployment));
        assertFalse(predicate.matches(deployment));
    }

    // =====================================================================
    // Compile errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Malformed predicates fail to compile")
    @ValueSource(strings = {
            "[invalid",
            "metadata.name ==",
            "metadata.name = 'x'",
            "metadata.",
            "(metadata.name",
            "unknown_function(metadata.name)",
            "starts_with(metadata.name)",
            "metadata.name | length(@)",
            "'unterminated",
            "`{not json`"
    })
    void rejectsMalformed(String expression) {
        PredicateException e = assertThrows(PredicateException.class, () -> PredicateCompiler.compile(expression));
        assertNotNull(e.getMessage());
    }

    @Test
    @DisplayName("Blank predicates are rejected")
    void rejectsBlank() {
        assertThrows(PredicateException.class, () -> PredicateCompiler.compile(""));
        assertThrows(PredicateException.class, () -> PredicateCompiler.compile("   "));
        assertThrows(PredicateException.class, () -> PredicateCompiler.compile(null));
    }

    @Test
    @DisplayName("Compiled predicates keep their source text")
    void keepsExpression() {
        assertEquals("metadata.name", PredicateCompiler.compile("metadata.name").getExpression());
    }
}
