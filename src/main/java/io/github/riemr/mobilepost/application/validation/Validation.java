package io.github.riemr.mobilepost.application.validation;

import io.github.riemr.mobilepost.application.exception.ApiException;
import io.github.riemr.mobilepost.application.exception.ErrorCode;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a validator: either the (possibly normalised) value or a {@link ValidationFailure}.
 * A valid outcome may carry {@code null} when the checked value was legitimately absent.
 */
public final class Validation<T> {
    private final T value;
    private final ValidationFailure failure;

    private Validation(T value, ValidationFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Validation<T> valid(T value) {
        return new Validation<>(value, null);
    }

    public static <T> Validation<T> invalid(ValidationFailure failure) {
        return new Validation<>(null, Objects.requireNonNull(failure));
    }

    public static <T> Validation<T> invalid(ErrorCode code, String field, String message) {
        return invalid(ValidationFailure.of(code, field, message));
    }

    public static <T> Validation<T> invalid(ErrorCode code, List<String> fields, String message) {
        return invalid(new ValidationFailure(code, fields, message));
    }

    public boolean isValid() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value: " + failure.message());
        }
        return value;
    }

    public ValidationFailure getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Validation succeeded");
        }
        return failure;
    }

    public <U> Validation<U> flatMap(Function<? super T, Validation<U>> mapper) {
        return isValid() ? mapper.apply(value) : invalid(failure);
    }

    /** Re-types a failed outcome so it can be returned from a validator of another type. */
    public <U> Validation<U> asFailure() {
        return invalid(getFailure());
    }

    public T orElseThrow() {
        if (failure != null) {
            throw new ApiException(failure.code(), failure.message());
        }
        return value;
    }
}
