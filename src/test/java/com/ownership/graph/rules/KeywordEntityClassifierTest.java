package com.ownership.graph.rules;

import com.ownership.graph.core.model.NodeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeywordEntityClassifier Tests")
class KeywordEntityClassifierTest {

    private final KeywordEntityClassifier classifier = new KeywordEntityClassifier();

    @ParameterizedTest
    @DisplayName("Should classify names with corporate keywords as entities")
    @ValueSource(strings = {
            "ABC REALTY LLC", "ACME INC", "WEST SIDE HOLDINGS", "SMITH FAMILY TRUST",
            "BLUE MANAGEMENT CORP", "EAST RIVER ASSOCIATES", "NORTH GROUP", "KINGS CO"
    })
    void entities(String name) {
        assertTrue(classifier.isBusinessEntity(name));
        assertEquals(NodeKind.ENTITY, classifier.classify(name));
    }

    @ParameterizedTest
    @DisplayName("Should classify plain names as people")
    @ValueSource(strings = {"JOHN SMITH", "MARIA GARCIA", "JANE DOE"})
    void people(String name) {
        assertFalse(classifier.isBusinessEntity(name));
        assertEquals(NodeKind.PERSON, classifier.classify(name));
    }

    @Test
    @DisplayName("Should match keywords as whole words only")
    void wholeWords() {
        assertFalse(classifier.isBusinessEntity("COLLINS"));
        assertFalse(classifier.isBusinessEntity("LINCOLN"));
        assertFalse(classifier.isBusinessEntity("TRUSTMAN"));
    }

    @Test
    @DisplayName("Should treat null and blank as people")
    void nullAndBlank() {
        assertFalse(classifier.isBusinessEntity(null));
        assertFalse(classifier.isBusinessEntity(" "));
    }

    @Test
    @DisplayName("Should accept a custom keyword set")
    void customKeywords() {
        KeywordEntityClassifier custom = new KeywordEntityClassifier(Set.of("gmbh", "ag"));

        assertTrue(custom.isBusinessEntity("SIEMENS AG"));
        assertFalse(custom.isBusinessEntity("ACME LLC"));
        assertEquals(Set.of("GMBH", "AG"), custom.getKeywords());
    }

    @Test
    @DisplayName("Should reject an empty keyword set")
    void emptyKeywords() {
        assertThrows(IllegalArgumentException.class, () -> new KeywordEntityClassifier(Set.of()));
    }
}
