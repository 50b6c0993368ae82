package io.github.riemr.mobilepost.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum Language {
    EN("en"),
    TC("tc"),
    SC("sc"),
    /** every language column plus English aliases */
    ALL("all");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** The single language used for resolved values; {@code ALL} resolves like English. */
    public Language effective() {
        return this == ALL ? EN : this;
    }

    public static Optional<Language> fromCode(String code) {
        return Arrays.stream(values()).filter(l -> l.code.equals(code)).findFirst();
    }
}
