package com.ringlist.util;

import com.ringlist.api.LinkedNode;
import com.ringlist.ring.RingList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural checks for a sentinel ring.
 *
 * <p>
 * Verifies, for a given sentinel and expected size:
 * <ul>
 * <li><b>Closure:</b> exactly {@code size} successor steps from the sentinel's
 * successor lead back to the sentinel, and likewise for predecessors.</li>
 * <li><b>Symmetry:</b> every successor link is matched by the inverse
 * predecessor link.</li>
 * <li><b>Sentinel:</b> the sentinel is flagged as such and holds the default
 * value. With {@code size == 0} both its links point at itself.</li>
 * </ul>
 *
 * <p>
 * Every walk is bounded by {@code size + 1} steps, so a corrupted ring is
 * reported rather than looped on. Intended for tests and debugging sessions,
 * not for per-operation use.
 */
public final class RingVerifier {
    private static final Logger log = LogManager.getLogger(RingVerifier.class);

    private RingVerifier() {
        // Utility class
    }

    public static <T> List<String> violations(RingList<T> list) {
        return violations(list.sentinel(), list.size(), list.defaultValue());
    }

    /**
     * @return Human-readable descriptions of every broken invariant; empty when
     *         the ring is well formed.
     */
    public static List<String> violations(LinkedNode<?> sentinel, int size, Object expectedDefault) {
        List<String> out = new ArrayList<>();
        if (!sentinel.isSentinel())
            out.add("Start node is not a sentinel");
        if (!Objects.equals(sentinel.value(), expectedDefault))
            out.add("Sentinel holds " + sentinel.value() + " instead of default " + expectedDefault);
        if (size < 0) {
            out.add("Negative size " + size);
            return out;
        }
        walk(sentinel, size, true, out);
        walk(sentinel, size, false, out);
        return out;
    }

    /**
     * Throws if the list violates any ring invariant.
     *
     * @throws IllegalStateException listing every violation found.
     */
    public static <T> void verify(RingList<T> list) {
        List<String> found = violations(list);
        if (found.isEmpty())
            return;
        for (String v : found)
            log.warn("Ring invariant violated: {}", v);
        throw new IllegalStateException("Ring invariants violated: " + String.join("; ", found));
    }

    private static void walk(LinkedNode<?> sentinel, int size, boolean forward, List<String> out) {
        final String dir = forward ? "Forward" : "Backward";
        LinkedNode<?> current = sentinel;
        for (int step = 1; step <= size; step++) {
            LinkedNode<?> following = step(current, forward);
            if (following == null) {
                out.add(dir + " link missing after " + (step - 1) + " nodes");
                return;
            }
            if (following == sentinel) {
                out.add(dir + " ring closes after " + (step - 1) + " nodes, size is " + size);
                return;
            }
            if (step(following, !forward) != current)
                out.add(dir + " link at step " + step + " has no matching inverse link");
            current = following;
        }

        LinkedNode<?> closing = step(current, forward);
        if (closing != sentinel) {
            out.add(dir + " ring does not close after " + size + " nodes");
        } else if (step(sentinel, !forward) != current) {
            out.add(dir + " closing link into the sentinel has no matching inverse link");
        }
    }

    private static LinkedNode<?> step(LinkedNode<?> node, boolean forward) {
        return forward ? node.next() : node.prev();
    }
}
