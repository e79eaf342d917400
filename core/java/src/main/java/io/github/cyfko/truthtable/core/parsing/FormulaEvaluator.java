package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.ast.BinOp;
import io.github.cyfko.truthtable.core.ast.Node;
import io.github.cyfko.truthtable.core.ast.Not;
import io.github.cyfko.truthtable.core.ast.VarRef;
import io.github.cyfko.truthtable.core.exception.EvaluationException;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a syntax tree against an assignment of truth values.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>AND: true iff both operands are true</li>
 *   <li>OR: true iff at least one operand is true</li>
 *   <li>XOR: true iff the operands differ</li>
 *   <li>IFF: true iff the operands are equal</li>
 *   <li>IMPLIES: false iff the left operand is true and the right one false</li>
 *   <li>NOT: complement of its operand</li>
 * </ul>
 *
 * <p>
 * Both operands of a binary node are always evaluated, so an incomplete assignment fails the same
 * way whatever the values of the assigned variables.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaEvaluator {

    /**
     * Computes the truth value of {@code node} under {@code assignment}.
     *
     * @param node       root of the tree to evaluate
     * @param assignment truth value of every variable referenced by {@code node}
     * @return the truth value of the tree
     * @throws EvaluationException if a referenced variable is absent from the assignment or mapped to {@code null}
     * @throws NullPointerException if node or assignment is null
     */
    public boolean evaluate(Node node, Map<String, Boolean> assignment) {
        Objects.requireNonNull(node, "node cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");
        return eval(node, assignment);
    }

    private boolean eval(Node node, Map<String, Boolean> assignment) {
        if (node instanceof VarRef ref) {
            Boolean value = assignment.get(ref.name());
            if (value == null) {
                throw new EvaluationException(ref.name());
            }
            return value;
        }

        if (node instanceof Not not) {
            return !eval(not.operand(), assignment);
        }

        BinOp op = (BinOp) node;
        boolean left = eval(op.left(), assignment);
        boolean right = eval(op.right(), assignment);

        return switch (op.kind()) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left != right;
            case IFF -> left == right;
            case IMPLIES -> !left || right;
            case NOT -> throw new IllegalStateException("NOT is not a binary connective");
        };
    }
}
