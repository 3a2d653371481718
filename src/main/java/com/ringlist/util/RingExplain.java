package com.ringlist.util;

import com.ringlist.api.LinkedNode;
import com.ringlist.ring.RingList;

/**
 * Diagnostic utility for inspecting a ring list's links.
 *
 * <p>
 * Generates human-readable dumps showing each node with its predecessor and
 * successor. Positions are zero-based from the front; the sentinel is shown
 * as {@code [S]}.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and test failure messages.
 * Every walk is bounded by the list size.
 */
public final class RingExplain<T> {
    private final RingList<T> list;

    public RingExplain(RingList<T> list) {
        this.list = list;
    }

    /**
     * Dumps the node at {@code index}.
     *
     * @throws IllegalArgumentException if {@code index} is not a valid position.
     */
    public String explainNode(int index) {
        if (index < 0 || index >= list.size())
            throw new IllegalArgumentException("No node at index " + index + " (size " + list.size() + ")");
        LinkedNode<T> node = list.sentinel().next();
        for (int i = 0; i < index && node != null; i++)
            node = node.next();
        if (node == null)
            throw new IllegalStateException("Ring is cut before index " + index);

        StringBuilder sb = new StringBuilder(128);
        sb.append("Node: [").append(index).append("] ").append(label(node)).append('\n')
                .append("  Prev: ").append(label(node.prev())).append('\n')
                .append("  Next: ").append(label(node.next())).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the sentinel and every element in successor order.
     */
    public String dumpRing() {
        LinkedNode<T> sentinel = list.sentinel();
        StringBuilder sb = new StringBuilder(64 * (list.size() + 2));
        sb.append("Ring (").append(list.size()).append(" nodes):\n");
        appendLine(sb, "S", sentinel);

        LinkedNode<T> node = sentinel.next();
        for (int i = 0; i < list.size() && node != null && node != sentinel; i++) {
            appendLine(sb, Integer.toString(i), node);
            node = node.next();
        }
        return sb.toString();
    }

    private void appendLine(StringBuilder sb, String position, LinkedNode<T> node) {
        sb.append("  [").append(position).append("] ").append(label(node))
                .append(" prev=").append(label(node.prev()))
                .append(" next=").append(label(node.next()))
                .append('\n');
    }

    private String label(LinkedNode<T> node) {
        if (node == null)
            return "null";
        if (node.isSentinel())
            return list.format().endMarker();
        return list.renderer().render(node.value());
    }
}
