package com.regvalidator.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Academic term kind. Summer terms have a lower credit cap than regular terms.
 */
public enum SemesterType {
    FIRST("First"),
    SECOND("Second"),
    SUMMER("Summer");

    private final String label;

    SemesterType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isSummer() {
        return this == SUMMER;
    }

    public static Optional<SemesterType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (SemesterType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
