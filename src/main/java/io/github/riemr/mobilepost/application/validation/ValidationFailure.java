package io.github.riemr.mobilepost.application.validation;

import io.github.riemr.mobilepost.application.exception.ErrorCode;

import java.util.List;

/**
 * Why a value was rejected.
 *
 * @param code    error code the failure surfaces as
 * @param fields  offending field name(s)
 * @param message human readable explanation
 */
public record ValidationFailure(ErrorCode code, List<String> fields, String message) {

    public ValidationFailure {
        fields = List.copyOf(fields);
    }

    public static ValidationFailure of(ErrorCode code, String field, String message) {
        return new ValidationFailure(code, List.of(field), message);
    }
}
