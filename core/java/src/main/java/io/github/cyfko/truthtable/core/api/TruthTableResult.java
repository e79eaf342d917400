package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.table.TruthTable;

/**
 * Outcome of {@link TruthTableEngine#evaluate(String)}: either a complete table or an error, never both.
 * <p>
 * Instances are immutable and created via {@link #success(TruthTable)} and {@link #failure(ErrorKind, String)}.
 * </p>
 *
 * <pre>{@code
 * TruthTableResult result = engine.evaluate(userInput);
 * if (result.isSuccess()) {
 *     render(result.getTable());
 * } else {
 *     showError(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableResult {

    private final TruthTable table;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private TruthTableResult(TruthTable table, ErrorKind errorKind, String errorMessage) {
        this.table = table;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static TruthTableResult success(TruthTable table) {
        if (table == null) {
            throw new IllegalArgumentException("A successful result requires a table");
        }
        return new TruthTableResult(table, null, null);
    }

    public static TruthTableResult failure(ErrorKind errorKind, String errorMessage) {
        if (errorKind == null) {
            throw new IllegalArgumentException("A failed result requires an error kind");
        }
        return new TruthTableResult(null, errorKind, errorMessage);
    }

    public boolean isSuccess() {
        return table != null;
    }

    /**
     * @return the table, or null if this result is a failure
     */
    public TruthTable getTable() {
        return table;
    }

    /**
     * @return the error kind, or null if this result is a success
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return the error message, or null if this result is a success
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "TruthTableResult[success, variables=" + table.variables() + ", rows=" + table.rowCount() + "]"
                : "TruthTableResult[failure, kind=" + errorKind + ", error=" + errorMessage + "]";
    }
}
