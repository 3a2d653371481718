package com.ringlist.ring;

import com.ringlist.util.RingVerifier;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Breaks links behind the list's back to check that walks stay bounded and
 * that the broken-ring path of removeIndex reports instead of corrupting further.
 */
public class RingListCorruptionTest {

    private RingList<Integer> list;
    private RingNode<Integer> sentinel;

    @Before
    public void setUp() {
        list = RingList.newList(0);
        for (int i = 0; i < 5; i++)
            list.add(i);
        sentinel = (RingNode<Integer>) list.sentinel();
    }

    @Test
    public void testRemoveReportsNotFoundWhenRingShortCircuits() {
        // 4 -> 3 -> (sentinel), while size still says 5
        RingNode<Integer> three = sentinel.next.next;
        three.next = sentinel;

        try {
            list.removeIndex(3);
            fail("Should report the unreachable index");
        } catch (RingListException e) {
            assertEquals(RingListException.Reason.NOT_FOUND, e.reason());
            assertEquals(3, e.index());
        }
        assertEquals(5, list.size());
    }

    @Test
    public void testRemoveReportsNotFoundOnCutLink() {
        sentinel.next.next = null;

        try {
            list.removeIndex(2);
            fail("Should report the unreachable index");
        } catch (RingListException e) {
            assertEquals(RingListException.Reason.NOT_FOUND, e.reason());
        }
    }

    @Test
    public void testRenderStopsAtSize() {
        // Successor loop that never returns to the sentinel: 4 -> 3 -> 4 -> ...
        RingNode<Integer> four = sentinel.next;
        four.next.next = four;

        assertEquals("4 -> 3 -> 4 -> 3 -> 4 -> (sentinel)\n", list.render());
    }

    @Test
    public void testIndexOfStopsAtSize() {
        RingNode<Integer> four = sentinel.next;
        four.next.next = four;

        assertFalse(list.indexOf(0).isPresent());
        assertEquals(1, list.indexOf(3).getAsInt());
    }

    @Test
    public void testVerifierSeesBrokenInverseLink() {
        RingNode<Integer> two = sentinel.next.next.next;
        two.prev = sentinel;

        assertFalse(RingVerifier.violations(list).isEmpty());
        try {
            RingVerifier.verify(list);
            fail("Should reject broken ring");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("inverse"));
        }
    }
}
