package io.github.riemr.mobilepost.application.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced in the {@code err_code} field of every error envelope.
 * The first two digits are the category: 01 validation, 02 not found, 03 conflict,
 * 04 server, 05 unauthorized.
 */
public enum ErrorCode {
    MISSING_REQUIRED_FIELD("0101", "Missing required field", HttpStatus.BAD_REQUEST),
    NO_UPDATABLE_FIELDS("0102", "No updatable fields provided", HttpStatus.BAD_REQUEST),
    INVALID_PARAMETER_VALUE("0103", "Invalid parameter value", HttpStatus.BAD_REQUEST),
    INVALID_TIME_FORMAT("0104", "Time must be a valid time in HH:MM format (00:00-23:59)", HttpStatus.BAD_REQUEST),
    INVALID_LANGUAGE("0105", "Invalid language. Supported values: en, tc, sc, all", HttpStatus.BAD_REQUEST),
    INVALID_NUMERIC_VALUE("0106", "Invalid numeric value", HttpStatus.BAD_REQUEST),
    RECORD_NOT_FOUND("0201", "Record not found", HttpStatus.NOT_FOUND),
    DUPLICATE_RECORD("0301", "Duplicate record", HttpStatus.CONFLICT),
    SERVER_ERROR("0401", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
    UNAUTHORIZED("0501", "Unauthorized", HttpStatus.UNAUTHORIZED);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
