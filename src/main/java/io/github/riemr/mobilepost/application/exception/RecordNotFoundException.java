package io.github.riemr.mobilepost.application.exception;

public class RecordNotFoundException extends ApiException {
    public RecordNotFoundException(Long id) {
        super(ErrorCode.RECORD_NOT_FOUND, "Mobile post with id " + id + " not found");
    }
}
