package com.versioning.engine.validation;

import com.versioning.core.exception.VersioningException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a precondition check: valid, or the first typed failure.
 * Checks are chained with {@link #then(Supplier)}; later checks are not
 * evaluated once one has failed.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null);

    private final VersioningException failure;

    private ValidationResult(VersioningException failure) {
        this.failure = failure;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(VersioningException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("A failed validation needs a cause");
        }
        return new ValidationResult(failure);
    }

    /**
     * Valid if the condition holds, otherwise fail with the supplied exception.
     */
    public static ValidationResult check(boolean condition, Supplier<? extends VersioningException> failure) {
        return condition ? VALID : invalid(failure.get());
    }

    public boolean isValid() {
        return failure == null;
    }

    public Optional<VersioningException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Run the next check only if this one passed.
     */
    public ValidationResult then(Supplier<ValidationResult> next) {
        return isValid() ? next.get() : this;
    }

    /**
     * Throw the failure, if any.
     */
    public void orElseThrow() {
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid]" : "ValidationResult[" + failure.getErrorCode() + "]";
    }
}
