package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.table.TruthTable;
import io.github.cyfko.truthtable.core.table.TruthTableRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableResultTest {

    private static final TruthTable IDENTITY = new TruthTable(List.of("P"), List.of(
            new TruthTableRow(0, List.of("P"), false),
            new TruthTableRow(1, List.of("P"), true)));

    @Test
    @DisplayName("Success should carry the table only")
    void success() {
        TruthTableResult result = TruthTableResult.success(IDENTITY);

        assertTrue(result.isSuccess());
        assertSame(IDENTITY, result.getTable());
        assertNull(result.getErrorKind());
        assertEquals("TruthTableResult[success, variables=[P], rows=2]", result.toString());
    }

    @Test
    @DisplayName("Failure should carry the kind and message only")
    void failure() {
        TruthTableResult result = TruthTableResult.failure(ErrorKind.PARSE, "Unmatched '(' at position 0");

        assertFalse(result.isSuccess());
        assertNull(result.getTable());
        assertEquals(ErrorKind.PARSE, result.getErrorKind());
        assertEquals("Unmatched '(' at position 0", result.getErrorMessage());
        assertTrue(result.toString().contains("kind=PARSE"));
    }

    @Test
    @DisplayName("Should reject incomplete results")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> TruthTableResult.success(null));
        assertThrows(IllegalArgumentException.class, () -> TruthTableResult.failure(null, "message"));
    }
}
