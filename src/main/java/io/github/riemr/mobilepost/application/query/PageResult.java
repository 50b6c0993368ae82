package io.github.riemr.mobilepost.application.query;

import java.util.List;

/**
 * One window of rows plus the number of rows matching the filter before windowing.
 */
public record PageResult<T>(List<T> records, long total) {

    public PageResult {
        records = List.copyOf(records);
    }
}
