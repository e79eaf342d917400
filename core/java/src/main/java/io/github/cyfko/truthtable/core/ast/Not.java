package io.github.cyfko.truthtable.core.ast;

import java.util.Objects;

/**
 * Negation of a single operand.
 *
 * @param operand the negated subtree
 */
public record Not(Node operand) implements Node {

    public Not {
        Objects.requireNonNull(operand, "operand cannot be null");
    }
}
