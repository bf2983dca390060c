package com.healloop.core.learning;

import java.util.Locale;

/**
 * Complexity of a user request as judged by the planner.
 */
public enum ComplexityLevel {
    SIMPLE,
    MODERATE,
    COMPLEX,
    VERY_COMPLEX,
    UNKNOWN;

    public static ComplexityLevel fromWire(String value) {
        if (value == null) return UNKNOWN;
        try {
            return valueOf(value.trim().replace(' ', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isComplex() {
        return this == COMPLEX || this == VERY_COMPLEX;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
