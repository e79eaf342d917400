package io.github.cyfko.truthtable.core.table;

import java.util.AbstractList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a truth table: a complete assignment and the formula's value under it.
 * <p>
 * The assignment is not stored: variable {@code k} of {@code n} holds bit {@code n-1-k} of {@link #index()},
 * so a row costs the same whatever the number of variables.
 * </p>
 *
 * @param index     zero-based row index; its n-bit binary form, most significant bit first, gives {@link #values()}
 * @param variables column names, shared with the owning {@link TruthTable}
 * @param result    value of the formula under this assignment
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableRow(int index, List<String> variables, boolean result) {

    public TruthTableRow {
        variables = List.copyOf(Objects.requireNonNull(variables, "variables cannot be null"));
        if (index < 0 || index >= (1 << variables.size())) {
            throw new IllegalArgumentException(String.format(
                    "Row index %d out of range for %d variables", index, variables.size()));
        }
    }

    /**
     * @return value of each variable, in column order
     */
    public List<Boolean> values() {
        return new AbstractList<>() {
            @Override
            public Boolean get(int column) {
                Objects.checkIndex(column, variables.size());
                return bit(column);
            }

            @Override
            public int size() {
                return variables.size();
            }
        };
    }

    /**
     * Returns the value assigned to {@code variable} in this row.
     *
     * @param variable a column name
     * @return the assigned value
     * @throws IllegalArgumentException if the variable is not a column of this table
     */
    public boolean valueOf(String variable) {
        int column = variables.indexOf(variable);
        if (column < 0) {
            throw new IllegalArgumentException("Unknown variable '" + variable + "'. Available: " + variables);
        }
        return bit(column);
    }

    /**
     * Returns this row's assignment as a map iterating in column order.
     *
     * @return unmodifiable variable to value map
     */
    public Map<String, Boolean> assignment() {
        Map<String, Boolean> assignment = new LinkedHashMap<>(variables.size() * 2);
        for (int i = 0; i < variables.size(); i++) {
            assignment.put(variables.get(i), bit(i));
        }
        return Collections.unmodifiableMap(assignment);
    }

    private boolean bit(int column) {
        return ((index >> (variables.size() - 1 - column)) & 1) == 1;
    }
}
