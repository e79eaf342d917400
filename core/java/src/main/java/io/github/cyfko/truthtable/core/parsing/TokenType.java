package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Connective;

/**
 * Kinds of token produced by {@link FormulaTokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    VARIABLE(null),
    NOT(Connective.NOT),
    AND(Connective.AND),
    OR(Connective.OR),
    IMPLIES(Connective.IMPLIES),
    IFF(Connective.IFF),
    XOR(Connective.XOR),
    LEFT_PAREN(null),
    RIGHT_PAREN(null);

    private final Connective connective;

    TokenType(Connective connective) {
        this.connective = connective;
    }

    /**
     * @return the connective this token denotes, or {@code null} for variables and parentheses
     */
    public Connective connective() {
        return connective;
    }

    static TokenType of(Connective connective) {
        return switch (connective) {
            case NOT -> NOT;
            case AND -> AND;
            case OR -> OR;
            case IMPLIES -> IMPLIES;
            case IFF -> IFF;
            case XOR -> XOR;
        };
    }
}
