package com.ringlist.util;

import com.ringlist.api.ValueRenderer;

import java.util.Locale;

/**
 * Standard implementations of ValueRenderer.
 */
public final class ValueRenderers {
    private ValueRenderers() {
        // Utility class
    }

    /** Renders with {@code String.valueOf}, so null renders as "null". */
    public static final ValueRenderer<Object> TO_STRING = String::valueOf;

    /** Wraps the value in double quotes. Null stays unquoted. */
    public static final ValueRenderer<Object> QUOTED = v -> v == null ? "null" : "\"" + v + "\"";

    /**
     * Renders numbers with a fixed number of fraction digits, independent of the
     * default locale.
     */
    public static ValueRenderer<Number> fixedPrecision(int digits) {
        if (digits < 0)
            throw new IllegalArgumentException("Negative precision: " + digits);
        final String pattern = "%." + digits + "f";
        return v -> v == null ? "null" : String.format(Locale.ROOT, pattern, v.doubleValue());
    }
}
