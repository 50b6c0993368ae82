package io.github.riemr.mobilepost.presentation.controller;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.github.riemr.mobilepost.application.dto.ApiResponse;
import io.github.riemr.mobilepost.application.exception.ApiException;
import io.github.riemr.mobilepost.application.exception.BatchSourceException;
import io.github.riemr.mobilepost.application.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps every failure onto the error envelope. Internal causes are logged here and never copied into {@code err_msg}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    static final String DB_UNAVAILABLE = "Database connection error. Please try again later.";

    @ExceptionHandler(BatchSourceException.class)
    public ResponseEntity<ApiResponse.Failure> handleBatchSource(BatchSourceException e) {
        log.error("Import source failure: {}", e.getMessage(), e.getCause());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse.Failure> handleApi(ApiException e) {
        log.debug("Request rejected [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
        return respond(e.getErrorCode().getStatus(), e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse.Failure> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER_VALUE, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse.Failure> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UnrecognizedPropertyException unrecognized) {
            return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER_VALUE,
                    "property " + unrecognized.getPropertyName() + " should not exist");
        }
        if (cause instanceof MismatchedInputException mismatch) {
            Class<?> target = mismatch.getTargetType();
            if (target != null && (Number.class.isAssignableFrom(target) || target.isPrimitive())) {
                return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_NUMERIC_VALUE,
                        fieldPath(mismatch) + " must be a number");
            }
        }
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER_VALUE, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse.Failure> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_NUMERIC_VALUE, e.getName() + " must be a number");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse.Failure> handleMissingPart(MissingServletRequestPartException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER_VALUE,
                "A file part named '" + e.getRequestPartName() + "' is required");
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiResponse.Failure> handleMultipart(MultipartException e) {
        log.warn("Rejected multipart upload: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAMETER_VALUE, "Invalid or oversized multipart upload");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse.Failure> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorCode.INVALID_PARAMETER_VALUE,
                "Content type " + e.getContentType() + " is not supported");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse.Failure> handleMethod(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ErrorCode.INVALID_PARAMETER_VALUE, e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse.Failure> handleNoResource(NoResourceFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ErrorCode.RECORD_NOT_FOUND, "No endpoint " + e.getResourcePath());
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ApiResponse.Failure> handleDuplicate(DuplicateKeyException e) {
        log.warn("Uniqueness violation: {}", rootCause(e).getMessage());
        return respond(HttpStatus.CONFLICT, ErrorCode.DUPLICATE_RECORD, ErrorCode.DUPLICATE_RECORD.getDefaultMessage());
    }

    /** Connection failures surface either from the data access layer or while the transaction manager opens a connection. */
    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ApiResponse.Failure> handleStorageUnavailable(Exception e) {
        log.error("Storage unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.SERVER_ERROR, DB_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse.Failure> handleException(Exception e) {
        Throwable root = rootCause(e);
        log.error("Unhandled exception occurred (root cause {}: {})", root.getClass().getSimpleName(), root.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.SERVER_ERROR, ErrorCode.SERVER_ERROR.getDefaultMessage());
    }

    private static ResponseEntity<ApiResponse.Failure> respond(HttpStatus status, ErrorCode code, String message) {
        return new ResponseEntity<>(ApiResponse.error(code, message), status);
    }

    private static String fieldPath(MismatchedInputException e) {
        return e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
