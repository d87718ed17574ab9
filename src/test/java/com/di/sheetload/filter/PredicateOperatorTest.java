package com.di.sheetload.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PredicateOperator Tests")
class PredicateOperatorTest {

    @ParameterizedTest
    @CsvSource({"equals, EQUALS", "EQUALS, EQUALS", "in-set, IN_SET", "not_null, NOT_NULL", " Not-Null , NOT_NULL"})
    @DisplayName("Should parse config labels")
    void testFromLabel(String label, PredicateOperator expected) {
        assertEquals(expected, PredicateOperator.fromLabel(label));
    }

    @Test
    @DisplayName("Should reject unknown or blank labels")
    void testUnknownLabel() {
        assertThrows(IllegalArgumentException.class, () -> PredicateOperator.fromLabel("contains"));
        assertThrows(IllegalArgumentException.class, () -> PredicateOperator.fromLabel(" "));
        assertEquals("in-set", PredicateOperator.IN_SET.label());
    }

    @Test
    @DisplayName("Should compare values exactly")
    void testEvaluation() {
        assertTrue(PredicateOperator.EQUALS.test("SMD", List.of("SMD")));
        assertFalse(PredicateOperator.EQUALS.test("smd", List.of("SMD")));
        assertTrue(PredicateOperator.IN_SET.test("GMD", List.of("SMD", "GMD")));
        assertFalse(PredicateOperator.IN_SET.test("XMD", List.of("SMD", "GMD")));
        assertTrue(PredicateOperator.NOT_NULL.test("anything", List.of()));
    }

    @Test
    @DisplayName("Should enforce operand arity")
    void testArity() {
        assertThrows(IllegalArgumentException.class, () -> FilterPredicate.inSet("business-unit", List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new FilterPredicate("business-unit", PredicateOperator.EQUALS, List.of("SMD", "GMD")));
        assertThrows(IllegalArgumentException.class,
                () -> new FilterPredicate("business-unit", PredicateOperator.NOT_NULL, List.of("SMD")));
        assertEquals(List.of("SMD"), new FilterPredicate("business-unit", PredicateOperator.EQUALS, List.of(" SMD ")).operands());
    }
}
