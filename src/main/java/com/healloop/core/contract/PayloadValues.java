package com.healloop.core.contract;

import java.util.Collection;
import java.util.Map;

/**
 * Presence rules for payload values.
 */
public final class PayloadValues {

    private PayloadValues() {}

    /**
     * A value is missing when it is null, a blank string, or an empty collection or map.
     */
    public static boolean isMissing(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.toString().isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }
}
