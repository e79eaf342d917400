package io.github.cyfko.truthtable.core.ast;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Node of the abstract syntax tree of a propositional formula.
 * <p>
 * A formula is a strict tree: every node owns its children exclusively and nodes are immutable,
 * so a parsed tree can be evaluated any number of times, from any thread.
 * </p>
 *
 * <h2>Node Kinds</h2>
 * <ul>
 *   <li>{@link VarRef} - leaf referencing a variable by name</li>
 *   <li>{@link Not} - negation of a single operand</li>
 *   <li>{@link BinOp} - binary connective applied to two operands</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Node permits VarRef, Not, BinOp {

    /**
     * Returns the sorted, deduplicated names of the variables referenced under this node.
     *
     * @return variables in lexicographic ascending order
     */
    default SortedSet<String> variables() {
        SortedSet<String> names = new TreeSet<>();
        collectVariables(this, names);
        return names;
    }

    private static void collectVariables(Node node, SortedSet<String> names) {
        if (node instanceof VarRef ref) {
            names.add(ref.name());
        } else if (node instanceof Not not) {
            collectVariables(not.operand(), names);
        } else if (node instanceof BinOp op) {
            collectVariables(op.left(), names);
            collectVariables(op.right(), names);
        }
    }
}
