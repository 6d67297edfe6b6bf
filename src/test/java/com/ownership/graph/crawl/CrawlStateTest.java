package com.ownership.graph.crawl;

import com.ownership.graph.core.model.PropertyId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrawlStateTest {

    @Test
    @DisplayName("Each task key should be accepted once")
    void acceptOnce() {
        CrawlState state = new CrawlState();

        assertTrue(state.accept(new FrontierTask.PropertyTask(PropertyId.of("1", "100", "1"))));
        assertFalse(state.accept(new FrontierTask.PropertyTask(PropertyId.of("1", "100", "1"))));
        assertTrue(state.accept(new FrontierTask.NameTask("ABC REALTY LLC")));
        assertFalse(state.accept(new FrontierTask.NameTask("ABC REALTY LLC")));

        assertEquals(1, state.visitedPropertyCount());
        assertEquals(1, state.visitedNameCount());
    }

    @Test
    @DisplayName("Property and name sets should be independent")
    void separateSets() {
        CrawlState state = new CrawlState();

        assertTrue(state.markName("1-100-1"));
        assertTrue(state.markProperty("1-100-1"));
    }

    @Test
    @DisplayName("Registrations should be visited once")
    void registrations() {
        CrawlState state = new CrawlState();

        assertFalse(state.isRegistrationVisited("R1"));
        assertTrue(state.markRegistration("R1"));
        assertFalse(state.markRegistration("R1"));
        assertTrue(state.isRegistrationVisited("R1"));
        assertEquals(1, state.visitedRegistrationCount());
    }
}
