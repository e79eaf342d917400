package io.github.cyfko.truthtable.core.table;

/**
 * Classification of a formula read off the result column of its truth table.
 */
public enum Classification {
    /** True under every assignment. */
    TAUTOLOGY,
    /** False under every assignment. */
    CONTRADICTION,
    /** True under some assignments and false under others. */
    CONTINGENCY
}
