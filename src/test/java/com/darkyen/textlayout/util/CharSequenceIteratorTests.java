package com.darkyen.textlayout.util;

import org.junit.jupiter.api.Test;

import java.text.CharacterIterator;

import static org.junit.jupiter.api.Assertions.*;

public class CharSequenceIteratorTests {

    @Test
    public void iteratesRangeWithAbsoluteIndicesTest() {
        final CharSequenceIterator iterator = new CharSequenceIterator(new StringBuilder("hello"), 1, 4);
        assertEquals(1, iterator.getBeginIndex());
        assertEquals(4, iterator.getEndIndex());

        final StringBuilder seen = new StringBuilder();
        for (char c = iterator.first(); c != CharacterIterator.DONE; c = iterator.next()) {
            seen.append(c);
        }
        assertEquals("ell", seen.toString());
        assertEquals(4, iterator.getIndex());

        assertEquals('l', iterator.last());
        assertEquals(3, iterator.getIndex());
        assertEquals('l', iterator.previous());
        assertEquals('e', iterator.previous());
        assertEquals(CharacterIterator.DONE, iterator.previous());
        assertEquals(1, iterator.getIndex());
    }

    @Test
    public void setIndexTest() {
        final CharSequenceIterator iterator = new CharSequenceIterator("hello", 1, 4);
        assertEquals('l', iterator.setIndex(2));
        assertEquals(CharacterIterator.DONE, iterator.setIndex(4));
        assertThrows(IllegalArgumentException.class, () -> iterator.setIndex(0));
        assertThrows(IllegalArgumentException.class, () -> iterator.setIndex(5));
    }

    @Test
    public void emptyRangeAndCloneTest() {
        final CharSequenceIterator empty = new CharSequenceIterator("abc", 2, 2);
        assertEquals(CharacterIterator.DONE, empty.first());
        assertEquals(CharacterIterator.DONE, empty.last());
        assertEquals(CharacterIterator.DONE, empty.current());

        final CharSequenceIterator iterator = new CharSequenceIterator("abc", 0, 3);
        iterator.setIndex(1);
        final CharSequenceIterator clone = iterator.clone();
        iterator.next();
        assertEquals(1, clone.getIndex());
        assertEquals('b', clone.current());
    }
}
