package io.github.riemr.mobilepost.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum SortDirection {
    ASC("asc", "ASC"),
    DESC("desc", "DESC");

    private final String param;
    private final String sql;

    SortDirection(String param, String sql) {
        this.param = param;
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public static Optional<SortDirection> fromParam(String param) {
        return Arrays.stream(values()).filter(d -> d.param.equals(param)).findFirst();
    }
}
