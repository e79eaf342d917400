package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.ast.Node;
import io.github.cyfko.truthtable.core.ast.NodePrinter;

import java.util.List;
import java.util.Objects;

/**
 * A parsed propositional formula.
 * <p>
 * Instances are immutable and carry everything needed to build a truth table: the syntax tree
 * and its variable set, sorted in lexicographic ascending order. That order fixes both the column
 * order of the table and its enumeration order.
 * </p>
 *
 * <pre>{@code
 * Formula formula = engine.parse("(P ∧ Q) → R");
 * formula.variables();   // [P, Q, R]
 * formula.canonical();   // ((P ∧ Q) → R)
 * }</pre>
 *
 * @param source    the expression exactly as submitted
 * @param root      root of the syntax tree
 * @param variables sorted, deduplicated variable names referenced by {@code root}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Formula(String source, Node root, List<String> variables) {

    public Formula {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(root, "root cannot be null");
        variables = List.copyOf(variables);
    }

    /**
     * Creates a formula whose variable set is derived from {@code root}.
     *
     * @param source the expression exactly as submitted
     * @param root   root of the syntax tree
     */
    public Formula(String source, Node root) {
        this(source, root, List.copyOf(Objects.requireNonNull(root, "root cannot be null").variables()));
    }

    /**
     * Renders the formula fully parenthesized with canonical connective symbols.
     *
     * @return canonical form of the formula
     */
    public String canonical() {
        return NodePrinter.print(root);
    }
}
