package com.mcr.core.router;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class InputClassifierTest {

    private final InputClassifier classifier = new InputClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
            "Who is Bob's father?",
            "is tom a parent?",
            "WHAT does ann like",
            "Tell me where the cat sleeps",
            "  how many cats   ",
            "Can\tTom swim"
    })
    @DisplayName("questions and interrogatives are queries")
    void queries(String text) {
        assertEquals(InputClass.QUERY, classifier.classify(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Tom is Bob's father.",
            "Ann likes tea",
            "The showroom is downtown.",
            "Dogs canter in the park.",
            "I can't swim.",
            "Ann doesn't know Tom."
    })
    @DisplayName("statements are assertions, including words that merely contain a keyword")
    void assertions(String text) {
        assertEquals(InputClass.ASSERT, classifier.classify(text));
    }

    @Test
    @DisplayName("null input is treated as an assertion")
    void nullInput() {
        assertEquals(InputClass.ASSERT, classifier.classify(null));
    }

    @Test
    @DisplayName("input class values parse case-insensitively")
    void fromValue() {
        assertEquals(InputClass.QUERY, InputClass.fromValue(" Query "));
        assertThrows(IllegalArgumentException.class, () -> InputClass.fromValue("command"));
        assertThrows(IllegalArgumentException.class, () -> InputClass.fromValue(null));
    }
}
