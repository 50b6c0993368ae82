package io.github.riemr.mobilepost.application.exception;

public class DuplicateRecordException extends ApiException {

    public DuplicateRecordException(String message, Throwable cause) {
        super(ErrorCode.DUPLICATE_RECORD, message, cause);
    }
}
