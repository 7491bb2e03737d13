package com.mathhighlow.engine.evaluation;

/**
 * Value of an expression, or the reason it has none.
 */
public class EvaluationResult {
    private final boolean success;
    private final double value;
    private final EvaluationError error;

    private EvaluationResult(boolean success, double value, EvaluationError error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(double value) {
        return new EvaluationResult(true, value, null);
    }

    public static EvaluationResult failure(EvaluationError error) {
        return new EvaluationResult(false, Double.NaN, error);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * The computed value; {@code NaN} when evaluation failed.
     */
    public double getValue() {
        return value;
    }

    /**
     * The failure reason, or {@code null} on success.
     */
    public EvaluationError getError() {
        return error;
    }

    public String getErrorMessage() {
        return error == null ? "" : error.getMessage();
    }

    @Override
    public String toString() {
        return success ? "EvaluationResult(" + value + ")" : "EvaluationResult(" + error.getMessage() + ")";
    }
}
