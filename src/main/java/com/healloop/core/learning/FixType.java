package com.healloop.core.learning;

import java.util.Locale;

/**
 * Kind of fix a failure analysis recommends.
 */
public enum FixType {
    CODE,
    CONFIG,
    DOCUMENTATION,
    UNKNOWN;

    public static FixType fromWire(String value) {
        if (value == null) return UNKNOWN;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
