package com.healloop.core.patch;

import java.util.Locale;
import java.util.Optional;

public enum PatchOperation {
    REPLACE,
    CREATE,
    APPEND;

    public static Optional<PatchOperation> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (PatchOperation op : values()) {
            if (op.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
