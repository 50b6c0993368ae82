package io.github.riemr.mobilepost.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.riemr.mobilepost.application.exception.ErrorCode;

/**
 * Envelope header, discriminated by {@code success}. A success header only ever carries
 * {@code message}; an error header only ever carries {@code err_code} and {@code err_msg}.
 */
public abstract class ResponseHeader {

    private ResponseHeader() {}

    public abstract boolean isSuccess();

    public static SuccessHeader success(String message) {
        return new SuccessHeader(message == null ? "Operation successful" : message);
    }

    public static ErrorHeader error(ErrorCode code, String message) {
        return new ErrorHeader(code, message == null ? code.getDefaultMessage() : message);
    }

    @JsonPropertyOrder({"success", "message"})
    public static final class SuccessHeader extends ResponseHeader {
        private final String message;

        private SuccessHeader(String message) {
            this.message = message;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        public String getMessage() {
            return message;
        }
    }

    @JsonPropertyOrder({"success", "err_code", "err_msg"})
    public static final class ErrorHeader extends ResponseHeader {
        private final ErrorCode errorCode;
        private final String errMsg;

        private ErrorHeader(ErrorCode errorCode, String errMsg) {
            this.errorCode = errorCode;
            this.errMsg = errMsg;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @JsonProperty("err_code")
        public String getErrCode() {
            return errorCode.getCode();
        }

        @JsonProperty("err_msg")
        public String getErrMsg() {
            return errMsg;
        }
    }
}
