package com.ringlist.ring;

import com.ringlist.api.LinkedNode;
import com.ringlist.api.RingFormat;
import com.ringlist.api.ValueRenderer;
import com.ringlist.util.ValueRenderers;

import java.util.Objects;
import java.util.OptionalInt;

import lombok.extern.log4j.Log4j2;

/**
 * RingList -- doubly-linked list closed into a ring by a sentinel node.
 *
 * Layout:
 * The sentinel is always present. Its successor is the front element and its
 * predecessor is the back element; with no elements both links point at the
 * sentinel itself. Walking successor links from the sentinel visits every
 * element exactly once and arrives back at the sentinel after {@code size}
 * steps, and the predecessor direction mirrors it.
 *
 * Ordering:
 * {@link #add(Object)} inserts at the front, so position 0 is always the most
 * recently added element.
 *
 * Bounded walks:
 * Every traversal stops after at most {@code size} steps, so a malformed ring
 * can never make an operation loop forever.
 *
 * Not thread-safe. Callers sharing a list across threads must guard it
 * externally.
 *
 * @param <T> Element type. Equality is {@link Objects#equals(Object, Object)},
 *            so null elements are allowed.
 */
@Log4j2
public final class RingList<T> {
    private final RingNode<T> sentinel;
    private final T defaultValue;
    private final RingFormat format;
    private final ValueRenderer<? super T> renderer;

    // Number of real (non-sentinel) nodes in the ring.
    private int size;

    /**
     * Creates an empty list with the default format and {@code String.valueOf}
     * rendering.
     *
     * @param defaultValue Value stored in the sentinel. Never read as content.
     */
    public RingList(T defaultValue) {
        this(defaultValue, RingFormat.DEFAULT, ValueRenderers.TO_STRING);
    }

    public RingList(T defaultValue, RingFormat format, ValueRenderer<? super T> renderer) {
        this.format = Objects.requireNonNull(format, "format");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.defaultValue = defaultValue;
        this.sentinel = RingNode.sentinel(defaultValue);
    }

    public static <T> RingList<T> newList(T defaultValue) {
        return new RingList<>(defaultValue);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Returns the sentinel, the entry point for walking the ring in either direction. */
    public LinkedNode<T> sentinel() {
        return sentinel;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public RingFormat format() {
        return format;
    }

    public ValueRenderer<? super T> renderer() {
        return renderer;
    }

    /**
     * Inserts {@code value} directly after the sentinel, making it element 0.
     * O(1).
     */
    public void add(T value) {
        final RingNode<T> first = sentinel.next;
        final RingNode<T> node = RingNode.linked(value, sentinel, first);
        // On an empty list 'first' is the sentinel, which closes the backward ring.
        first.prev = node;
        sentinel.next = node;
        size++;
        log.trace("Added {} at front, size {}", value, size);
    }

    /**
     * Removes and returns the element at {@code index}, counting from the front.
     * O(index).
     *
     * @throws RingListException with {@link RingListException.Reason#EMPTY_LIST}
     *                           if the list is empty,
     *                           {@link RingListException.Reason#INDEX_OUT_OF_BOUNDS}
     *                           if {@code index} is negative or
     *                           {@code >= size()}, and
     *                           {@link RingListException.Reason#NOT_FOUND} if the
     *                           ring is broken and the walk never reached
     *                           {@code index}. The list is unchanged in every case.
     */
    public T removeIndex(int index) throws RingListException {
        if (isEmpty()) {
            log.debug("Rejected removal of index {} from empty list", index);
            throw RingListException.emptyList(index);
        }
        if (index < 0 || index >= size) {
            log.debug("Rejected removal of index {} from list of size {}", index, size);
            throw RingListException.outOfBounds(index, size);
        }

        RingNode<T> target = nodeAt(index);
        if (target == null) {
            log.error("Ring walk ended before index {} with size {}; ring is broken", index, size);
            throw RingListException.notFound(index);
        }
        T value = unlink(target);
        log.trace("Removed {} from index {}, size {}", value, index, size);
        return value;
    }

    /**
     * Returns the position of the first element equal to {@code value}, or empty
     * if there is none. Compares at most {@code size} elements.
     */
    public OptionalInt indexOf(T value) {
        RingNode<T> current = sentinel.next;
        for (int i = 0; i < size; i++) {
            if (Objects.equals(current.value, value))
                return OptionalInt.of(i);
            current = current.next;
        }
        return OptionalInt.empty();
    }

    public boolean contains(T value) {
        return indexOf(value).isPresent();
    }

    /**
     * Renders the elements front to back, each followed by the delimiter, then
     * the end marker and terminator. An empty list renders as the end marker
     * alone.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(16 * (size + 1));
        RingNode<T> current = sentinel.next;
        for (int i = 0; i < size && current != sentinel; i++) {
            sb.append(renderer.render(current.value)).append(format.delimiter());
            current = current.next;
        }
        return sb.append(format.endMarker()).append(format.terminator()).toString();
    }

    @Override
    public String toString() {
        return render();
    }

    // Walks at most 'size' successor links; null if the sentinel (or a cut link) comes first.
    private RingNode<T> nodeAt(int index) {
        RingNode<T> current = sentinel.next;
        for (int i = 0; i < size && current != null && current != sentinel; i++) {
            if (i == index)
                return current;
            current = current.next;
        }
        return null;
    }

    private T unlink(RingNode<T> node) {
        final T value = node.value;
        final RingNode<T> prev = node.prev;
        final RingNode<T> next = node.next;
        prev.next = next;
        next.prev = prev;
        node.detach();
        size--;
        return value;
    }
}
