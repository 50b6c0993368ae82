package io.github.riemr.mobilepost.application.importing;

import io.github.riemr.mobilepost.application.exception.ErrorCode;

public enum IrregularityReason {
    MISSING_REQUIRED_FIELD(ErrorCode.MISSING_REQUIRED_FIELD),
    INVALID_TIME_FORMAT(ErrorCode.INVALID_TIME_FORMAT),
    INVALID_PARAMETER_VALUE(ErrorCode.INVALID_PARAMETER_VALUE),
    INVALID_NUMERIC_VALUE(ErrorCode.INVALID_NUMERIC_VALUE),
    /** dedup key already stored before this run */
    DUPLICATE_EXISTING(ErrorCode.DUPLICATE_RECORD),
    /** dedup key accepted earlier in the same batch */
    DUPLICATE_IN_BATCH(ErrorCode.DUPLICATE_RECORD),
    /** storage rejected the row on its uniqueness constraint */
    STORAGE_CONFLICT(ErrorCode.DUPLICATE_RECORD);

    private final ErrorCode errorCode;

    IrregularityReason(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static IrregularityReason of(ErrorCode code) {
        switch (code) {
            case MISSING_REQUIRED_FIELD:
                return MISSING_REQUIRED_FIELD;
            case INVALID_TIME_FORMAT:
                return INVALID_TIME_FORMAT;
            case INVALID_NUMERIC_VALUE:
                return INVALID_NUMERIC_VALUE;
            case DUPLICATE_RECORD:
                return STORAGE_CONFLICT;
            default:
                return INVALID_PARAMETER_VALUE;
        }
    }
}
