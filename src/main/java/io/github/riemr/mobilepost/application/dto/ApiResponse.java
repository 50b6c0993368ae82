package io.github.riemr.mobilepost.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.riemr.mobilepost.application.exception.ErrorCode;

/**
 * Response envelope. {@link Success} is {@code {header, result, meta?}}, {@link Failure} is
 * {@code {header}} and never has a result.
 */
public abstract class ApiResponse<T> {

    private ApiResponse() {}

    public abstract ResponseHeader getHeader();

    @JsonIgnore
    public boolean isSuccess() {
        return getHeader().isSuccess();
    }

    public static <T> Success<T> success(String message, T result) {
        return new Success<>(ResponseHeader.success(message), result, null);
    }

    public static <T> Success<T> success(String message, T result, PageMeta meta) {
        return new Success<>(ResponseHeader.success(message), result, meta);
    }

    public static Failure error(ErrorCode code) {
        return new Failure(ResponseHeader.error(code, null));
    }

    public static Failure error(ErrorCode code, String message) {
        return new Failure(ResponseHeader.error(code, message));
    }

    @JsonPropertyOrder({"header", "result", "meta"})
    public static final class Success<T> extends ApiResponse<T> {
        private final ResponseHeader.SuccessHeader header;
        private final T result;
        private final PageMeta meta;

        private Success(ResponseHeader.SuccessHeader header, T result, PageMeta meta) {
            this.header = header;
            this.result = result;
            this.meta = meta;
        }

        @Override
        public ResponseHeader.SuccessHeader getHeader() {
            return header;
        }

        @JsonInclude(JsonInclude.Include.ALWAYS)
        public T getResult() {
            return result;
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        public PageMeta getMeta() {
            return meta;
        }
    }

    public static final class Failure extends ApiResponse<Void> {
        private final ResponseHeader.ErrorHeader header;

        private Failure(ResponseHeader.ErrorHeader header) {
            this.header = header;
        }

        @Override
        public ResponseHeader.ErrorHeader getHeader() {
            return header;
        }
    }
}
