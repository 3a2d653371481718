package com.ringlist.api;

/**
 * Read-only view of a node in a sentinel ring.
 *
 * Every node, including the sentinel, has a successor and a predecessor. In a
 * well-formed ring the two relations are strict inverses: if {@code a.next()}
 * is {@code b} then {@code b.prev()} is {@code a}.
 *
 * A node that has been removed from its list is detached: its value and both
 * links read as {@code null}.
 *
 * @param <T> The type of value held by the node.
 */
public interface LinkedNode<T> {

    /**
     * Returns the stored value. For the sentinel this is the list's default
     * value, which is never list content.
     */
    T value();

    /** Returns the successor, or {@code null} once the node is detached. */
    LinkedNode<T> next();

    /** Returns the predecessor, or {@code null} once the node is detached. */
    LinkedNode<T> prev();

    /** Returns true for the list's permanent boundary node. */
    boolean isSentinel();
}
