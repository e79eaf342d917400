package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.config.EnginePolicy;

/**
 * Exception thrown when a formula has more distinct variables than the active
 * {@link EnginePolicy} allows.
 * <p>
 * A table over n variables has 2<sup>n</sup> rows, so the bound caps the time and memory a single
 * request may consume.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class VariableLimitExceededException extends TruthTableException {

    private final int variableCount;
    private final int maxVariables;

    /**
     * @param variableCount number of distinct variables in the formula
     * @param maxVariables  maximum allowed by the policy
     * @param policyName    name of the policy that was applied
     */
    public VariableLimitExceededException(int variableCount, int maxVariables, String policyName) {
        super(String.format(
                "Too many variables (%d distinct, max: %d). Policy applied: %s",
                variableCount, maxVariables, policyName
        ));
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    /**
     * @return number of distinct variables in the rejected formula
     */
    public int getVariableCount() {
        return variableCount;
    }

    /**
     * @return maximum number of variables allowed by the policy
     */
    public int getMaxVariables() {
        return maxVariables;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.VARIABLE_LIMIT;
    }
}
