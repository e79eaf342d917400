package io.github.cyfko.truthtable.core.utils;

import io.github.cyfko.truthtable.core.impl.BasicTruthTableEngine;
import io.github.cyfko.truthtable.core.table.TruthTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableFormatterTest {

    private static final String NL = System.lineSeparator();

    private final TruthTable xor = new BasicTruthTableEngine().generateTruthTable("P ⊕ Q");

    @Test
    @DisplayName("Default formatter should render T/F cells under a Result column")
    void defaults() {
        String expected = "| P | Q | Result |" + NL
                + "|---|---|--------|" + NL
                + "| F | F | F      |" + NL
                + "| F | T | T      |" + NL
                + "| T | F | T      |" + NL
                + "| T | T | F      |" + NL;

        assertEquals(expected, TruthTableFormatter.defaults().format(xor));
    }

    @Test
    @DisplayName("Custom labels should widen columns as needed")
    void customLabels() {
        String output = new TruthTableFormatter("Vrai", "Faux", "Resultado").format(xor);
        String[] lines = output.split(NL);

        assertEquals(6, lines.length);
        assertEquals("| P    | Q    | Resultado |", lines[0]);
        assertEquals("|------|------|-----------|", lines[1]);
        assertEquals("| Faux | Vrai | Vrai      |", lines[3]);
    }

    @Test
    @DisplayName("Should reject missing labels and tables")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new TruthTableFormatter("", "F", "Result"));
        assertThrows(IllegalArgumentException.class, () -> new TruthTableFormatter("T", null, "Result"));
        assertThrows(IllegalArgumentException.class, () -> new TruthTableFormatter("T", "F", ""));
        assertThrows(NullPointerException.class, () -> TruthTableFormatter.defaults().format(null));
    }
}
