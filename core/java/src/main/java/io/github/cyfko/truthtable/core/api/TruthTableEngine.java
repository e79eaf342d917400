package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.EvaluationException;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;
import io.github.cyfko.truthtable.core.exception.VariableLimitExceededException;
import io.github.cyfko.truthtable.core.table.TruthTable;

import java.util.List;

/**
 * Entry point for UI collaborators: parses propositional formulas and builds their truth tables.
 *
 * <h2>Expression Syntax</h2>
 * <table border="1">
 * <caption>Syntax Reference</caption>
 * <thead>
 * <tr><th>Element</th><th>Form</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Variable</td><td>one ASCII letter, case-sensitive</td><td>P, q</td></tr>
 * <tr><td>Negation</td><td>~ (alias !)</td><td>~P</td></tr>
 * <tr><td>Conjunction</td><td>∧ (alias &amp;)</td><td>P ∧ Q</td></tr>
 * <tr><td>Disjunction</td><td>∨ (alias |)</td><td>P ∨ Q</td></tr>
 * <tr><td>Exclusive or</td><td>⊕ (alias ^)</td><td>P ⊕ Q</td></tr>
 * <tr><td>Implication</td><td>→ (alias -&gt;)</td><td>P → Q</td></tr>
 * <tr><td>Biconditional</td><td>↔ (alias &lt;-&gt;)</td><td>P ↔ Q</td></tr>
 * <tr><td>Grouping</td><td>( )</td><td>(P ∨ Q) ∧ R</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Precedence from tightest to loosest: ~, ∧, ∨, ⊕, →, ↔. Binary connectives are left-associative.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TruthTableEngine engine = new BasicTruthTableEngine();
 *
 * // Two-step
 * Formula formula = engine.parse("(P ∧ Q) → R");
 * TruthTable table = engine.computeTruthTable(formula);
 *
 * // One-step, exceptions
 * TruthTable same = engine.generateTruthTable("(P ∧ Q) → R");
 *
 * // One-step, no exceptions
 * TruthTableResult result = engine.evaluate("(P ∧ Q");
 * result.getErrorKind();     // PARSE
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TruthTableEngine {

    /**
     * Parses an expression into a formula.
     *
     * @param expression the raw expression
     * @return the parsed formula
     * @throws LexicalException       if an unrecognized character is found
     * @throws FormulaSyntaxException if the expression is empty, has no variables or is malformed
     */
    Formula parse(String expression) throws LexicalException, FormulaSyntaxException;

    /**
     * Builds the complete truth table of a parsed formula.
     *
     * @param formula the formula
     * @return the table, one row per assignment of the formula's variables
     * @throws VariableLimitExceededException if the formula has more variables than the policy allows
     * @throws EvaluationException            if an evaluation fails
     */
    TruthTable computeTruthTable(Formula formula) throws VariableLimitExceededException, EvaluationException;

    /**
     * Parses an expression and builds its truth table.
     *
     * @param expression the raw expression
     * @return the table
     * @throws io.github.cyfko.truthtable.core.exception.TruthTableException on any failure
     */
    default TruthTable generateTruthTable(String expression) {
        return computeTruthTable(parse(expression));
    }

    /**
     * Parses an expression and builds its truth table, reporting failures as a value.
     *
     * @param expression the raw expression
     * @return a successful result holding the table, or a failed result holding the error
     */
    TruthTableResult evaluate(String expression);

    /**
     * Returns the connectives this engine understands, in palette order.
     *
     * @return immutable list of connectives
     */
    default List<Connective> connectives() {
        return Connective.palette();
    }
}
