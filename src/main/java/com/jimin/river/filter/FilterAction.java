package com.jimin.river.filter;

import java.util.Locale;
import java.util.Optional;

public enum FilterAction {
    KEEP("keep"),
    DISCARD("discard");

    private final String wireName;

    FilterAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FilterAction> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FilterAction action : values()) {
            if (action.wireName.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
