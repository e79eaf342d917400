package io.github.cyfko.truthtable.core.ast;

/**
 * Leaf node referencing a variable.
 *
 * @param name the variable name, case-sensitive
 */
public record VarRef(String name) implements Node {

    public VarRef {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name is required");
        }
    }
}
