package io.github.cyfko.truthtable.core.api;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The logical connectives understood by the engine.
 * <p>
 * Precedence values grow with binding strength: {@link #IFF} binds loosest and {@link #NOT} tightest.
 * All binary connectives are left-associative; {@link #NOT} is a right-associative prefix operator.
 * </p>
 *
 * <table border="1">
 * <caption>Connective Reference</caption>
 * <thead>
 * <tr><th>Connective</th><th>Symbol</th><th>ASCII alias</th><th>Precedence</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>~</td><td>!</td><td>6</td></tr>
 * <tr><td>AND</td><td>∧</td><td>&amp;</td><td>5</td></tr>
 * <tr><td>OR</td><td>∨</td><td>|</td><td>4</td></tr>
 * <tr><td>XOR</td><td>⊕</td><td>^</td><td>3</td></tr>
 * <tr><td>IMPLIES</td><td>→</td><td>-&gt;</td><td>2</td></tr>
 * <tr><td>IFF</td><td>↔</td><td>&lt;-&gt;</td><td>1</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Connective {
    AND("∧", "&", "Conjunction (AND)", "True when both operands are true", 5),
    OR("∨", "|", "Disjunction (OR)", "True when at least one operand is true", 4),
    NOT("~", "!", "Negation", "Inverts the truth value of its operand", 6),
    IMPLIES("→", "->", "Implication", "If ... then: false only when the premise is true and the conclusion false", 2),
    IFF("↔", "<->", "Biconditional", "If and only if: true when both operands are equal", 1),
    XOR("⊕", "^", "Exclusive OR", "True when the operands differ", 3);

    private final String symbol;
    private final String asciiAlias;
    private final String displayName;
    private final String description;
    private final int precedence;

    Connective(String symbol, String asciiAlias, String displayName, String description, int precedence) {
        this.symbol = symbol;
        this.asciiAlias = asciiAlias;
        this.displayName = displayName;
        this.description = description;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public String asciiAlias() {
        return asciiAlias;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isUnary() {
        return this == NOT;
    }

    /**
     * Looks a connective up by its canonical symbol or, when {@code includeAliases} is set, its ASCII alias.
     *
     * @param text           the symbol text
     * @param includeAliases whether ASCII aliases are accepted
     * @return the matching connective, or empty if none
     */
    public static Optional<Connective> fromSymbol(String text, boolean includeAliases) {
        if (text == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> c.symbol.equals(text) || (includeAliases && c.asciiAlias.equals(text)))
                .findFirst();
    }

    /**
     * Returns the connectives in palette order: the order in which a UI lists its operator buttons.
     *
     * @return immutable list of all connectives
     */
    public static List<Connective> palette() {
        return List.of(AND, OR, NOT, IMPLIES, IFF, XOR);
    }
}
