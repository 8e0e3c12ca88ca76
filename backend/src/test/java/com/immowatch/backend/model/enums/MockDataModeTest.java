package com.immowatch.backend.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MockDataModeTest {

    @Test
    void testFromLabel() {
        assertEquals(MockDataMode.EXACT, MockDataMode.fromLabel("exact"));
        assertEquals(MockDataMode.ENHANCED, MockDataMode.fromLabel(" ENHANCED "));
        assertNull(MockDataMode.fromLabel("curated"));
        assertNull(MockDataMode.fromLabel(null));
    }
}
