package io.github.cyfko.truthtable.core.parsing;

import java.util.Objects;

/**
 * A single lexical unit of a formula.
 *
 * @param type     the token kind
 * @param lexeme   the exact source text of the token (the variable name for {@link TokenType#VARIABLE})
 * @param position zero-based position of the token's first character in the expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String lexeme, int position) {

    public Token {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(lexeme, "lexeme cannot be null");
    }

    @Override
    public String toString() {
        return type == TokenType.VARIABLE ? type + "(" + lexeme + ")" : type.name();
    }
}
