package com.ringlist.ring;

import com.ringlist.api.LinkedNode;

/**
 * A node in a sentinel ring.
 *
 * Links are package-private so that only {@link RingList} rewires the ring.
 * A node is shared by its list and by both neighbours, and a link change made
 * through one reference is seen through every other.
 */
public final class RingNode<T> implements LinkedNode<T> {
    T value;
    RingNode<T> next;
    RingNode<T> prev;
    private final boolean sentinel;

    private RingNode(T value, RingNode<T> prev, RingNode<T> next, boolean sentinel) {
        this.value = value;
        this.prev = prev;
        this.next = next;
        this.sentinel = sentinel;
    }

    /**
     * Creates a sentinel holding {@code defaultValue}. The node cannot reference
     * itself until it exists, so it is allocated unlinked and then both links are
     * pointed back at it.
     */
    static <T> RingNode<T> sentinel(T defaultValue) {
        RingNode<T> s = new RingNode<>(defaultValue, null, null, true);
        s.next = s;
        s.prev = s;
        return s;
    }

    static <T> RingNode<T> linked(T value, RingNode<T> prev, RingNode<T> next) {
        return new RingNode<>(value, prev, next, false);
    }

    /** Clears value and links after the node has been bypassed by its neighbours. */
    void detach() {
        value = null;
        next = null;
        prev = null;
    }

    @Override
    public T value() {
        return value;
    }

    @Override
    public RingNode<T> next() {
        return next;
    }

    @Override
    public RingNode<T> prev() {
        return prev;
    }

    @Override
    public boolean isSentinel() {
        return sentinel;
    }

    public boolean isDetached() {
        return !sentinel && next == null && prev == null;
    }

    @Override
    public String toString() {
        return sentinel ? "RingNode(sentinel)" : "RingNode(" + value + ")";
    }
}
