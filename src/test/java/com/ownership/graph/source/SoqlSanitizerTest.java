package com.ownership.graph.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SoqlSanitizer Tests")
class SoqlSanitizerTest {

    @Test
    @DisplayName("Should double embedded quotes")
    void quote() {
        assertEquals("'O''BRIEN'", SoqlSanitizer.quote("O'BRIEN"));
        assertEquals("''", SoqlSanitizer.quote(null));
    }

    @Test
    @DisplayName("Contains patterns should drop wildcard characters")
    void containsPattern() {
        assertEquals("'%ACME HOLDINGS%'", SoqlSanitizer.containsPattern("ACME% HOLD_INGS"));
        assertEquals("'%''%'", SoqlSanitizer.containsPattern("'"));
    }

    @Test
    @DisplayName("Should reject control characters")
    void controlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> SoqlSanitizer.quote("ACME\nLLC"));
        assertThrows(IllegalArgumentException.class, () -> SoqlSanitizer.containsPattern("ACME\u007F"));
    }

    @Test
    @DisplayName("Should reject overlong literals")
    void length() {
        String max = "A".repeat(SoqlSanitizer.MAX_LITERAL_LENGTH);
        assertEquals("'" + max + "'", SoqlSanitizer.quote(max));
        assertThrows(IllegalArgumentException.class, () -> SoqlSanitizer.quote(max + "A"));
    }
}
