package com.mathhighlow.engine.evaluation;

/**
 * Reasons an expression cannot be given a value.
 */
public enum EvaluationError {
    EMPTY_EXPRESSION("empty expression"),
    MALFORMED_EXPRESSION("incomplete expression"),
    NEGATIVE_ROOT("negative argument to unary root"),
    DIVISION_BY_ZERO("division by zero"),
    /** A defect in the evaluator itself rather than a bad expression. */
    INTERNAL_FAULT("internal evaluation fault");

    private final String message;

    EvaluationError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
