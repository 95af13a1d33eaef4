package com.jimin.river.filter;

import java.util.Locale;
import java.util.Optional;

public enum PatternType {
    KEYWORD("keyword"),
    REGEX("regex");

    private final String wireName;

    PatternType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<PatternType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PatternType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
