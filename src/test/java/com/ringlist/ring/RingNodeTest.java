package com.ringlist.ring;

import org.junit.Test;

import static org.junit.Assert.*;

public class RingNodeTest {

    @Test
    public void testSentinelLinksToItself() {
        RingNode<String> s = RingNode.sentinel("");
        assertTrue(s.isSentinel());
        assertSame(s, s.next());
        assertSame(s, s.prev());
        assertEquals("", s.value());
        assertFalse(s.isDetached());
    }

    @Test
    public void testLinkedNode() {
        RingNode<String> s = RingNode.sentinel("");
        RingNode<String> n = RingNode.linked("v", s, s);
        assertFalse(n.isSentinel());
        assertSame(s, n.next());
        assertSame(s, n.prev());
        assertEquals("RingNode(v)", n.toString());
        assertEquals("RingNode(sentinel)", s.toString());
    }

    @Test
    public void testDetach() {
        RingNode<String> s = RingNode.sentinel("");
        RingNode<String> n = RingNode.linked("v", s, s);
        n.detach();
        assertTrue(n.isDetached());
        assertNull(n.value());
    }
}
