package com.qml.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VariableAutomaton.
 */
class VariableAutomatonTest {

    @ParameterizedTest
    @DisplayName("Classify identifier runs")
    @CsvSource({
            "x, true",
            "y, true",
            "z, true",
            "y_1, true",
            "z2, true",
            "x123, true",
            "z_07, true",
            "x_, false",
            "y__2, false",
            "zz2, false",
            "a, false",
            "X, false",
            "x.1, false",
            "x1_2, false",
            "x_1a, false",
            "John, false"
    })
    void classifyRuns(String run, boolean variable) {
        assertEquals(variable, VariableAutomaton.accepts(run));
    }

    @Test
    @DisplayName("Empty run is not a variable")
    void emptyRunRejected() {
        assertFalse(VariableAutomaton.accepts(""));
    }
}
