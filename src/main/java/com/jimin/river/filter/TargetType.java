package com.jimin.river.filter;

import java.util.Locale;
import java.util.Optional;

public enum TargetType {
    TITLE("title"),
    CONTENT("content"),
    FEED_CATEGORY("feed_category"),
    FEED_TAGS("feed_tags");

    private final String wireName;

    TargetType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TargetType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TargetType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
