package enricher.model;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowResultTest {

    private final RowTask task = new RowTask(4, Row.of(List.of("a"), List.of("1")));
    private final List<ColumnSpec> targets = ColumnSpec.parseList("x,y");

    @Test
    @DisplayName("Failure puts the sentinel into every target")
    void failureSentinel() {
        RowResult r = RowResult.failure(task, targets, "timeout", 12);

        assertTrue(r.isFailure());
        assertEquals(4, r.rowIndex());
        assertEquals(Map.of("x", "ERROR: timeout", "y", "ERROR: timeout"), r.values());
        assertEquals(12, r.costUnits());
        assertTrue(RowResult.isSentinel(r.values().get("x")));
    }

    @Test
    void blankDescriptionFallsBack() {
        RowResult r = RowResult.failure(task, targets, " ", 0);
        assertEquals("ERROR: unknown error", r.values().get("y"));
    }

    @Test
    void success() {
        RowResult r = RowResult.success(task, Map.of("x", "1", "y", "2"), 3);

        assertFalse(r.isFailure());
        assertNull(r.failure());
        assertFalse(RowResult.isSentinel(r.values().get("x")));
        assertThrows(UnsupportedOperationException.class, () -> r.values().put("x", "z"));
    }
}
