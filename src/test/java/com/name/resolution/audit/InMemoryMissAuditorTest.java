package com.name.resolution.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMissAuditorTest {

    @Test
    @DisplayName("Should keep misses in order and filter by reason")
    void testRecordAndQuery() {
        InMemoryMissAuditor auditor = new InMemoryMissAuditor();
        auditor.record("1", MissReason.NOT_FOUND_IN_BACKEND);
        auditor.record("2", MissReason.BACKEND_UNAVAILABLE);
        auditor.record("3", MissReason.NOT_FOUND_IN_BACKEND);

        assertEquals(3, auditor.size());
        assertEquals("1", auditor.getMisses().get(0).id());
        assertEquals(2, auditor.getMisses(MissReason.NOT_FOUND_IN_BACKEND).size());
        assertEquals("2", auditor.getMisses(MissReason.BACKEND_UNAVAILABLE).get(0).id());
    }

    @Test
    @DisplayName("Returned list should be immutable")
    void testImmutableView() {
        InMemoryMissAuditor auditor = new InMemoryMissAuditor();
        auditor.record("1", MissReason.NOT_FOUND_IN_BACKEND);

        assertThrows(UnsupportedOperationException.class, () -> auditor.getMisses().clear());
    }

    @Test
    @DisplayName("NoOp auditor should accept misses silently")
    void testNoOp() {
        MissAuditor auditor = new NoOpMissAuditor();
        assertDoesNotThrow(() -> {
            auditor.record("1", MissReason.NOT_FOUND_IN_BACKEND);
            auditor.close();
        });
    }
}
