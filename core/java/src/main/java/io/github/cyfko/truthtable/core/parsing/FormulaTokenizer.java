package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Connective;
import io.github.cyfko.truthtable.core.config.EnginePolicy;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Single-pass tokenizer turning a raw expression into typed {@link Token}s.
 * <p>
 * Recognized input:
 * </p>
 * <ul>
 *   <li>ASCII letters {@code A-Z a-z}: one {@link TokenType#VARIABLE} per letter, case-sensitive</li>
 *   <li>Parentheses {@code (} and {@code )}</li>
 *   <li>Canonical connective symbols {@code ~ ∧ ∨ → ↔ ⊕}</li>
 *   <li>ASCII aliases {@code ! & | -> <-> ^}, only when {@link EnginePolicy#asciiAliases()} is set</li>
 *   <li>Whitespace, which is discarded</li>
 * </ul>
 * Anything else raises a {@link LexicalException} naming the character and its position.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = FormulaTokenizer.tokenize("(P ∧ Q) → R", EnginePolicy.defaults());
 * // [LEFT_PAREN, VARIABLE(P), AND, VARIABLE(Q), RIGHT_PAREN, IMPLIES, VARIABLE(R)]
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaTokenizer {

    private static final int LONGEST_SYMBOL = Arrays.stream(Connective.values())
            .flatMap(c -> Stream.of(c.symbol(), c.asciiAlias()))
            .mapToInt(String::length)
            .max()
            .orElse(1);

    private FormulaTokenizer() {}

    /**
     * Tokenizes {@code expression} under the given policy.
     *
     * @param expression the raw expression
     * @param policy     limits and options to apply
     * @return immutable list of tokens in source order; empty if the expression holds only whitespace
     * @throws FormulaSyntaxException if the expression is {@code null} or longer than the policy allows
     * @throws LexicalException       if an unrecognized character is found
     */
    public static List<Token> tokenize(String expression, EnginePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        if (expression == null) {
            throw new FormulaSyntaxException("Expression cannot be null or empty");
        }

        String trimmed = expression.trim();

        // DoS protection
        if (trimmed.length() > policy.maxExpressionLength()) {
            throw new FormulaSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmed.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        List<Token> tokens = new ArrayList<>(expression.length());
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isVariableLetter(c)) {
                tokens.add(new Token(TokenType.VARIABLE, String.valueOf(c), i));
                i++;
                continue;
            }

            switch (c) {
                case '(' -> {
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", i));
                    i++;
                }
                case ')' -> {
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i));
                    i++;
                }
                default -> {
                    int length = matchConnective(expression, i, policy.asciiAliases(), tokens);
                    if (length == 0) {
                        throw new LexicalException(c, i);
                    }
                    i += length;
                }
            }
        }

        return Collections.unmodifiableList(tokens);
    }

    private static boolean isVariableLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    /**
     * Matches the longest connective symbol starting at {@code start} and appends its token.
     *
     * @return the number of characters consumed, 0 if no symbol matches
     */
    private static int matchConnective(String expression, int start, boolean asciiAliases, List<Token> tokens) {
        for (int length = Math.min(LONGEST_SYMBOL, expression.length() - start); length > 0; length--) {
            String candidate = expression.substring(start, start + length);
            Optional<Connective> connective = Connective.fromSymbol(candidate, asciiAliases);
            if (connective.isPresent()) {
                tokens.add(new Token(TokenType.of(connective.get()), candidate, start));
                return length;
            }
        }
        return 0;
    }
}
