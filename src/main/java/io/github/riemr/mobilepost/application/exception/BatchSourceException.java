package io.github.riemr.mobilepost.application.exception;

/**
 * The import source could not be read at all. Row-level problems are never reported this way.
 */
public class BatchSourceException extends ApiException {

    public BatchSourceException(String message) {
        super(ErrorCode.SERVER_ERROR, message);
    }

    public BatchSourceException(String message, Throwable cause) {
        super(ErrorCode.SERVER_ERROR, message, cause);
    }
}
