package org.muma.redislite.common;

import org.junit.jupiter.api.Test;
import org.muma.redislite.exception.StreamIdException;

import static org.junit.jupiter.api.Assertions.*;

class StreamIdTest {

    @Test
    void testParse() {
        assertEquals(new StreamId(1526919030474L, 55), StreamId.parse("1526919030474-55", 0));
        assertEquals(new StreamId(7, 0), StreamId.parse("7", 0));
        assertEquals(new StreamId(7, Long.MAX_VALUE), StreamId.parse("7", Long.MAX_VALUE));
    }

    @Test
    void testParseRejectsGarbage() {
        assertThrows(StreamIdException.class, () -> StreamId.parse("x-1", 0));
        assertThrows(StreamIdException.class, () -> StreamId.parse("1-", 0));
        assertThrows(StreamIdException.class, () -> StreamId.parse("-1", 0));
    }

    @Test
    void testOrdering() {
        assertTrue(new StreamId(1, 5).compareTo(new StreamId(2, 0)) < 0);
        assertTrue(new StreamId(2, 1).compareTo(new StreamId(2, 0)) > 0);
        assertEquals(0, new StreamId(3, 3).compareTo(new StreamId(3, 3)));
        assertTrue(StreamId.MIN.isZero());
        assertEquals("3-3", new StreamId(3, 3).toString());
    }
}
