package io.github.cyfko.truthtable.core.table;

import io.github.cyfko.truthtable.core.api.Formula;
import io.github.cyfko.truthtable.core.ast.Node;
import io.github.cyfko.truthtable.core.config.EnginePolicy;
import io.github.cyfko.truthtable.core.exception.EvaluationException;
import io.github.cyfko.truthtable.core.exception.VariableLimitExceededException;
import io.github.cyfko.truthtable.core.parsing.FormulaEvaluator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Enumerates every assignment of a formula's variables and evaluates the formula under each one.
 *
 * <h2>Enumeration Order</h2>
 * <p>
 * For variables {@code v0 < v1 < ... < v(n-1)}, row {@code i} runs from 0 to 2<sup>n</sup>-1 and assigns
 * {@code v_k = bit (n-1-k) of i}. Reading the variable columns of a row left to right gives the
 * binary representation of its index.
 * </p>
 *
 * <h2>Failure</h2>
 * <p>
 * The variable count is checked against {@link EnginePolicy#maxVariables()} before any row is
 * evaluated. An evaluation failure aborts the whole table; partial tables are never returned.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableGenerator {

    private static final Logger log = Logger.getLogger(TruthTableGenerator.class.getName());

    private final FormulaEvaluator evaluator;
    private final EnginePolicy policy;

    /**
     * @param evaluator evaluator invoked once per row
     * @param policy    limits to apply
     * @throws IllegalArgumentException if either argument is null
     */
    public TruthTableGenerator(FormulaEvaluator evaluator, EnginePolicy policy) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Evaluator is required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        this.evaluator = evaluator;
        this.policy = policy;
    }

    /**
     * Builds the truth table of a parsed formula.
     *
     * @param formula the formula
     * @return the complete table
     * @throws VariableLimitExceededException if the formula has more variables than the policy allows
     * @throws EvaluationException            if an evaluation fails
     */
    public TruthTable build(Formula formula) {
        Objects.requireNonNull(formula, "formula cannot be null");
        return build(formula.root(), formula.variables());
    }

    /**
     * Builds the truth table of {@code root} over {@code variables}.
     *
     * @param root      root of the syntax tree
     * @param variables the tree's variables, sorted in lexicographic ascending order
     * @return the complete table
     * @throws IllegalArgumentException       if {@code variables} is empty or differs from the tree's variable set
     * @throws VariableLimitExceededException if there are more variables than the policy allows
     * @throws EvaluationException            if an evaluation fails
     */
    public TruthTable build(Node root, List<String> variables) {
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(variables, "variables cannot be null");

        if (variables.isEmpty()) {
            throw new IllegalArgumentException("No variables found: a truth table needs at least one variable");
        }
        List<String> expected = new ArrayList<>(root.variables());
        if (!expected.equals(variables)) {
            throw new IllegalArgumentException(String.format(
                    "Variables %s do not match the formula's sorted variables %s", variables, expected));
        }

        int n = variables.size();
        if (n > policy.maxVariables()) {
            throw new VariableLimitExceededException(n, policy.maxVariables(), policy.policyName());
        }

        long start = System.nanoTime();
        List<String> columns = List.copyOf(variables);
        int rowCount = 1 << n;
        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        Map<String, Boolean> assignment = new HashMap<>(n * 2);

        for (int i = 0; i < rowCount; i++) {
            for (int k = 0; k < n; k++) {
                assignment.put(columns.get(k), ((i >> (n - 1 - k)) & 1) == 1);
            }
            boolean result = evaluator.evaluate(root, assignment);
            rows.add(new TruthTableRow(i, columns, result));
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.info(() -> String.format(
                "Truth table generated: %d variables, %d rows in %d ms", n, rowCount, durationMs));

        return new TruthTable(columns, rows);
    }
}
