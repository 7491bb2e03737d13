package com.mathhighlow.engine.validation;

/**
 * Outcome of checking an expression against a hand.
 *
 * <p>{@code errorMessage} is the generic text shown to the player; {@code detail} names the
 * exact rule that failed and is meant for logs and tests.
 */
public class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(true, "", "");

    private final boolean valid;
    private final String errorMessage;
    private final String detail;

    private ValidationResult(boolean valid, String errorMessage, String detail) {
        this.valid = valid;
        this.errorMessage = errorMessage;
        this.detail = detail;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String errorMessage, String detail) {
        return new ValidationResult(false, errorMessage, detail);
    }

    public boolean isValid() {
        return valid;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult(valid)" : "ValidationResult(invalid: " + detail + ")";
    }
}
