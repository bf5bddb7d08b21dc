package work.cinit.trace.runtime;

import work.cinit.trace.shared.ExtractionException;

/**
 * Raised when a branch or loop condition does not reduce to a concrete value.
 */
public final class NonConcreteConditionException extends ExtractionException {
    public static final String CODE = "non-concrete-condition";

    public NonConcreteConditionException(String condition, Object value) {
        super(CODE, "Condition '" + condition + "' does not reduce to a concrete value: " + Values.describe(value));
    }
}
