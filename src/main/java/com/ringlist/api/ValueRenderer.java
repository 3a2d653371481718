package com.ringlist.api;

/**
 * Renders a single list value as text.
 */
@FunctionalInterface
public interface ValueRenderer<T> {

    /**
     * @param value The stored value, possibly {@code null}.
     * @return The textual form used when rendering the list.
     */
    String render(T value);
}
