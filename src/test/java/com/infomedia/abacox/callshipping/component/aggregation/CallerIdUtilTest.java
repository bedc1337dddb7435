package com.infomedia.abacox.callshipping.component.aggregation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallerIdUtilTest {

    @Test
    void testTenantRoutingPrefixRemoved() {
        assertEquals("Jane Doe", CallerIdUtil.cleanCallerName("338-CFLAW-Jane Doe"));
    }

    @Test
    void testLongDashedNameKeepsLastSegment() {
        assertEquals("John Smith", CallerIdUtil.cleanCallerName("Sales Queue Overflow-Toronto-John Smith"));
    }

    @Test
    void testShortHyphenatedNameUntouched() {
        assertEquals("Mary-Jane Watson", CallerIdUtil.cleanCallerName("Mary-Jane Watson"));
    }

    @Test
    void testNumberOnlyNameCleared() {
        assertNull(CallerIdUtil.cleanCallerName("(647) 555-0100"));
        assertNull(CallerIdUtil.cleanCallerName("   "));
        assertNull(CallerIdUtil.cleanCallerName(null));
    }
}
