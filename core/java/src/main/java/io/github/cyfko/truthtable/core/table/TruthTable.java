package io.github.cyfko.truthtable.core.table;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Complete truth table of a formula.
 * <p>
 * Columns are the formula's variables in lexicographic ascending order, followed by the result.
 * Row {@code i} assigns to the k-th variable bit {@code n-1-k} of {@code i}: the first variable
 * changes slowest and row 0 is the all-false assignment.
 * </p>
 *
 * <pre>{@code
 * TruthTable table = engine.generateTruthTable("P ⊕ Q");
 * table.variables();       // [P, Q]
 * table.results();         // [false, true, true, false]
 * table.classification();  // CONTINGENCY
 * }</pre>
 *
 * @param variables sorted variable names, one column each
 * @param rows      the 2<sup>n</sup> rows in enumeration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(List<String> variables, List<TruthTableRow> rows) {

    public TruthTable {
        variables = List.copyOf(Objects.requireNonNull(variables, "variables cannot be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @return number of columns: one per variable plus the result column
     */
    public int columnCount() {
        return variables.size() + 1;
    }

    public TruthTableRow row(int index) {
        return rows.get(index);
    }

    /**
     * @return the result column, in row order
     */
    public List<Boolean> results() {
        return rows.stream().map(TruthTableRow::result).collect(Collectors.toUnmodifiableList());
    }

    public Classification classification() {
        boolean anyTrue = false;
        boolean anyFalse = false;
        for (TruthTableRow row : rows) {
            if (row.result()) anyTrue = true; else anyFalse = true;
        }
        if (!anyFalse) return Classification.TAUTOLOGY;
        if (!anyTrue) return Classification.CONTRADICTION;
        return Classification.CONTINGENCY;
    }

    public boolean isTautology() {
        return classification() == Classification.TAUTOLOGY;
    }

    public boolean isContradiction() {
        return classification() == Classification.CONTRADICTION;
    }

    public boolean isSatisfiable() {
        return classification() != Classification.CONTRADICTION;
    }
}
