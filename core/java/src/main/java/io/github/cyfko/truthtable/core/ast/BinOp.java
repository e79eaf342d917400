package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.api.Connective;

import java.util.Objects;

/**
 * Binary connective applied to two operands.
 *
 * @param kind  one of {@link Connective#AND}, {@link Connective#OR}, {@link Connective#IMPLIES},
 *              {@link Connective#IFF}, {@link Connective#XOR}
 * @param left  the left operand
 * @param right the right operand
 */
public record BinOp(Connective kind, Node left, Node right) implements Node {

    public BinOp {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
        if (kind.isUnary()) {
            throw new IllegalArgumentException("Connective " + kind + " is not binary");
        }
    }
}
