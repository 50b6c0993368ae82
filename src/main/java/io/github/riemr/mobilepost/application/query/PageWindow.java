package io.github.riemr.mobilepost.application.query;

/**
 * The row window {@code [offset, offset + limit)} a list request asks storage for.
 */
public record PageWindow(int page, int limit) {

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
