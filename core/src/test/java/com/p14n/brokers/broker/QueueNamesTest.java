package com.p14n.brokers.broker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueueNamesTest {

    @Test
    void shouldJoinGroupAndEvent() {
        assertEquals("orders:created", QueueNames.of("orders", null, "created"));
    }

    @Test
    void shouldTreatEmptySubgroupAsAbsent() {
        assertEquals("orders:created", QueueNames.of("orders", "", "created"));
    }

    @Test
    void shouldPlaceSubgroupBetweenGroupAndEvent() {
        assertEquals("orders:audit:created", QueueNames.of("orders", "audit", "created"));
    }

    @Test
    void shouldRejectMissingGroup() {
        assertThrows(NullPointerException.class, () -> QueueNames.of(null, null, "created"));
    }
}
