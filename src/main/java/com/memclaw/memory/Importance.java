package com.memclaw.memory;

import java.util.Locale;

public enum Importance {
    LOW, MEDIUM, HIGH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses "low" / "medium" / "high" in any case; null or blank means {@link #MEDIUM}. */
    public static Importance parse(String value) {
        if (value == null || value.isBlank()) return MEDIUM;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown importance: " + value, e);
        }
    }
}
