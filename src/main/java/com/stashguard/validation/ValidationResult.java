package com.stashguard.validation;

/**
 * Outcome of a validation pass: either ok, or the first failure encountered.
 */
public record ValidationResult(ValidationFailure failure) {

    private static final ValidationResult OK = new ValidationResult(null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(FailureCode code, String reason) {
        return new ValidationResult(ValidationFailure.of(code, reason));
    }

    public boolean isValid() {
        return failure == null;
    }

    /**
     * Prefixes the failure's location with {@code segment}; ok results are returned unchanged.
     */
    public ValidationResult within(String segment) {
        return isValid() ? this : new ValidationResult(failure.within(segment));
    }

    /**
     * @return the failure's reason chain, or null if valid
     */
    public String message() {
        return isValid() ? null : failure.message();
    }
}
