package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.api.Connective;

/**
 * Renders a tree in canonical form: canonical connective symbols, every binary node parenthesized.
 * <p>
 * The output shows exactly how precedence and associativity were resolved, e.g.
 * {@code P ∨ Q ∧ R} prints as {@code (P ∨ (Q ∧ R))} and {@code ~~P} as {@code ~~P}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodePrinter {

    private NodePrinter() {}

    public static String print(Node node) {
        StringBuilder builder = new StringBuilder();
        append(node, builder);
        return builder.toString();
    }

    private static void append(Node node, StringBuilder builder) {
        if (node instanceof VarRef ref) {
            builder.append(ref.name());
        } else if (node instanceof Not not) {
            builder.append(Connective.NOT.symbol());
            append(not.operand(), builder);
        } else if (node instanceof BinOp op) {
            builder.append('(');
            append(op.left(), builder);
            builder.append(' ').append(op.kind().symbol()).append(' ');
            append(op.right(), builder);
            builder.append(')');
        }
    }
}
