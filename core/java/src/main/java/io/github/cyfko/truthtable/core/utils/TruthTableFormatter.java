package io.github.cyfko.truthtable.core.utils;

import io.github.cyfko.truthtable.core.table.TruthTable;
import io.github.cyfko.truthtable.core.table.TruthTableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link TruthTable} as a plain-text grid.
 * <p>
 * One column per variable followed by the result column; cells hold the configured truth labels.
 * </p>
 *
 * <pre>{@code
 * TruthTableFormatter.defaults().format(engine.generateTruthTable("P ⊕ Q"));
 * // | P | Q | Result |
 * // |---|---|--------|
 * // | F | F | F      |
 * // | F | T | T      |
 * // | T | F | T      |
 * // | T | T | F      |
 *
 * new TruthTableFormatter("V", "F", "Resultado").format(table);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableFormatter {

    private final String trueLabel;
    private final String falseLabel;
    private final String resultHeader;

    /**
     * @param trueLabel    text of a true cell
     * @param falseLabel   text of a false cell
     * @param resultHeader header of the result column
     * @throws IllegalArgumentException if a label is null or empty
     */
    public TruthTableFormatter(String trueLabel, String falseLabel, String resultHeader) {
        this.trueLabel = requireLabel(trueLabel, "trueLabel");
        this.falseLabel = requireLabel(falseLabel, "falseLabel");
        this.resultHeader = requireLabel(resultHeader, "resultHeader");
    }

    /**
     * @return a formatter using {@code T}, {@code F} and {@code Result}
     */
    public static TruthTableFormatter defaults() {
        return new TruthTableFormatter("T", "F", "Result");
    }

    public String format(TruthTable table) {
        Objects.requireNonNull(table, "table cannot be null");

        List<String> headers = new ArrayList<>(table.variables());
        headers.add(resultHeader);

        int labelWidth = Math.max(trueLabel.length(), falseLabel.length());
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.max(headers.get(i).length(), labelWidth);
        }

        StringBuilder out = new StringBuilder();
        appendLine(out, headers, widths);

        out.append('|');
        for (int width : widths) {
            out.append("-".repeat(width + 2)).append('|');
        }
        out.append(System.lineSeparator());

        for (TruthTableRow row : table.rows()) {
            List<String> cells = new ArrayList<>(widths.length);
            for (Boolean value : row.values()) {
                cells.add(label(value));
            }
            cells.add(label(row.result()));
            appendLine(out, cells, widths);
        }
        return out.toString();
    }

    private String label(boolean value) {
        return value ? trueLabel : falseLabel;
    }

    private static void appendLine(StringBuilder out, List<String> cells, int[] widths) {
        out.append('|');
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            out.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        out.append(System.lineSeparator());
    }

    private static String requireLabel(String label, String name) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return label;
    }
}
