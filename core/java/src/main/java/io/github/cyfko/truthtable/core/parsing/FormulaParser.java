package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Connective;
import io.github.cyfko.truthtable.core.api.Formula;
import io.github.cyfko.truthtable.core.ast.BinOp;
import io.github.cyfko.truthtable.core.ast.Node;
import io.github.cyfko.truthtable.core.ast.Not;
import io.github.cyfko.truthtable.core.ast.VarRef;
import io.github.cyfko.truthtable.core.config.EnginePolicy;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;

import java.util.List;

/**
 * Recursive descent parser building an abstract syntax tree from {@link FormulaTokenizer} tokens.
 *
 * <h2>Grammar (EBNF, loosest binding first)</h2>
 * <pre>
 * formula  := implies ( '↔' implies )*
 * implies  := xor ( '→' xor )*
 * xor      := or ( '⊕' or )*
 * or       := and ( '∨' and )*
 * and      := unary ( '∧' unary )*
 * unary    := '~' unary | atom
 * atom     := VARIABLE | '(' formula ')'
 * </pre>
 * <p>
 * Every binary connective is left-associative, implication included: {@code P → Q → R}
 * reads as {@code (P → Q) → R}.
 * </p>
 *
 * <h2>Rejected Input</h2>
 * <ul>
 *   <li>Empty or blank expression</li>
 *   <li>Expression without any variable ("No variables found in expression")</li>
 *   <li>Unmatched {@code (} or {@code )}, empty parentheses</li>
 *   <li>Leading binary operator, trailing operator, missing operand between operators</li>
 *   <li>Two operands without an operator between them</li>
 *   <li>Nesting deeper than {@link EnginePolicy#maxNestingDepth()}</li>
 * </ul>
 *
 * <p>
 * Instances hold the cursor of a single parse and are not reusable; use the static entry points.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaParser {

    private static final Connective[] BINARY_LEVELS = {
            Connective.IFF, Connective.IMPLIES, Connective.XOR, Connective.OR, Connective.AND
    };

    private final List<Token> tokens;
    private final EnginePolicy policy;
    /** Index of the next token to consume. */
    private int current = 0;
    private int depth = 0;

    private FormulaParser(List<Token> tokens, EnginePolicy policy) {
        this.tokens = tokens;
        this.policy = policy;
    }

    /**
     * Tokenizes and parses {@code expression}.
     *
     * @param expression the raw expression
     * @param policy     limits and options to apply
     * @return the parsed formula
     * @throws LexicalException       if an unrecognized character is found
     * @throws FormulaSyntaxException if the expression is not a well-formed formula
     */
    public static Formula parse(String expression, EnginePolicy policy) {
        List<Token> tokens = FormulaTokenizer.tokenize(expression, policy);
        return new Formula(expression, parseTokens(tokens, policy));
    }

    /**
     * Parses an already tokenized expression.
     *
     * @param tokens tokens in source order
     * @param policy limits to apply
     * @return the root of the syntax tree
     * @throws FormulaSyntaxException if the tokens do not form a well-formed formula
     */
    public static Node parseTokens(List<Token> tokens, EnginePolicy policy) {
        if (tokens == null || tokens.isEmpty()) {
            throw new FormulaSyntaxException("Expression cannot be null or empty");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        if (tokens.stream().noneMatch(t -> t.type() == TokenType.VARIABLE)) {
            throw new FormulaSyntaxException("No variables found in expression");
        }

        return new FormulaParser(tokens, policy).formula();
    }

    private Node formula() {
        Node root = binary(0);

        if (!isAtEnd()) {
            Token extra = peek();
            if (extra.type() == TokenType.RIGHT_PAREN) {
                throw new FormulaSyntaxException(
                        "Unmatched ')' at position " + extra.position(), extra.position());
            }
            if (extra.type() == TokenType.NOT && current == tokens.size() - 1) {
                throw new FormulaSyntaxException(String.format(
                        "Missing operand after '%s' at position %d", extra.lexeme(), extra.position()),
                        extra.position());
            }
            throw missingOperator(extra);
        }
        return root;
    }

    private Node binary(int level) {
        if (level == BINARY_LEVELS.length) {
            return unary();
        }

        Connective connective = BINARY_LEVELS[level];
        Node left = binary(level + 1);
        while (!isAtEnd() && peek().type().connective() == connective) {
            current++;
            Node right = binary(level + 1);
            left = new BinOp(connective, left, right);
        }
        return left;
    }

    private Node unary() {
        if (!isAtEnd() && peek().type() == TokenType.NOT) {
            Token not = advance();
            enter(not);
            Node operand = unary();
            depth--;
            return new Not(operand);
        }
        return atom();
    }

    private Node atom() {
        if (isAtEnd()) {
            Token last = previous();
            if (last.type() == TokenType.LEFT_PAREN) {
                throw unmatchedOpening(last);
            }
            throw new FormulaSyntaxException(String.format(
                    "Missing operand after '%s' at position %d", last.lexeme(), last.position()),
                    last.position());
        }

        Token token = advance();
        switch (token.type()) {
            case VARIABLE -> {
                return new VarRef(token.lexeme());
            }
            case LEFT_PAREN -> {
                enter(token);
                Node inner = binary(0);
                if (isAtEnd()) {
                    throw unmatchedOpening(token);
                }
                Token closing = advance();
                if (closing.type() != TokenType.RIGHT_PAREN) {
                    throw missingOperator(closing);
                }
                depth--;
                return inner;
            }
            case RIGHT_PAREN -> {
                if (current == 1) {
                    throw new FormulaSyntaxException(
                            "Unmatched ')' at position " + token.position(), token.position());
                }
                Token before = tokens.get(current - 2);
                if (before.type() == TokenType.LEFT_PAREN) {
                    throw new FormulaSyntaxException(
                            "Empty parentheses at position " + before.position(), before.position());
                }
                throw new FormulaSyntaxException(String.format(
                        "Missing operand after '%s' at position %d", before.lexeme(), before.position()),
                        before.position());
            }
            default -> {
                // binary operator where an operand was expected
                if (current == 1) {
                    throw new FormulaSyntaxException(String.format(
                            "Expression cannot start with binary operator '%s'", token.lexeme()), token.position());
                }
                throw new FormulaSyntaxException(String.format(
                        "Missing operand before '%s' at position %d", token.lexeme(), token.position()),
                        token.position());
            }
        }
    }

    private void enter(Token token) {
        if (++depth > policy.maxNestingDepth()) {
            throw new FormulaSyntaxException(String.format(
                    "Expression nested too deeply at position %d (max depth: %d). Policy applied: %s",
                    token.position(), policy.maxNestingDepth(), policy.policyName()
            ), token.position());
        }
    }

    private FormulaSyntaxException unmatchedOpening(Token opening) {
        return new FormulaSyntaxException(
                "Unmatched '(' at position " + opening.position(), opening.position());
    }

    private FormulaSyntaxException missingOperator(Token token) {
        return new FormulaSyntaxException(
                "Missing operator between operands at position " + token.position(), token.position());
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token advance() {
        return tokens.get(current++);
    }
}
