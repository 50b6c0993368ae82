package io.github.riemr.mobilepost.domain.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public enum SortField {
    ID("id"),
    SEQ("seq"),
    DISTRICT("district"),
    OPEN_HOUR("openHour"),
    CLOSE_HOUR("closeHour"),
    NAME("name");

    private final String param;

    SortField(String param) {
        this.param = param;
    }

    public String getParam() {
        return param;
    }

    public static Optional<SortField> fromParam(String param) {
        return Arrays.stream(values()).filter(f -> f.param.equals(param)).findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(SortField::getParam).collect(Collectors.joining(", "));
    }
}
