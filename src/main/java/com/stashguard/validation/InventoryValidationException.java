package com.stashguard.validation;

/**
 * Thrown when a submitted payload cannot be turned into inventory items at all.
 */
public class InventoryValidationException extends Exception {

    private final ValidationFailure failure;

    public InventoryValidationException(ValidationFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
