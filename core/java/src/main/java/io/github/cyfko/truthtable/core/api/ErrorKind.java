package io.github.cyfko.truthtable.core.api;

/**
 * Categories of failure reported by a {@link TruthTableEngine}.
 * <p>
 * Every {@link io.github.cyfko.truthtable.core.exception.TruthTableException} belongs to exactly one kind,
 * which lets UI callers branch on the failure without inspecting exception types.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ErrorKind {
    /** An unrecognized character was found while tokenizing. */
    LEX,
    /** The token sequence is not a well-formed formula. */
    PARSE,
    /** An assignment did not define a variable referenced by the formula. */
    EVAL,
    /** The formula has more distinct variables than the policy allows. */
    VARIABLE_LIMIT
}
