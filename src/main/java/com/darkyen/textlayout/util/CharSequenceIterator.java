package com.darkyen.textlayout.util;

import java.text.CharacterIterator;

/**
 * CharacterIterator that works on a char sequence in given bounds.
 * Indices reported by this iterator are indices into the whole sequence, not into the range.
 */
public final class CharSequenceIterator implements CharacterIterator {

    private CharSequence chars;
    private int start, end;

    private int position;

    public CharSequenceIterator() {
    }

    public CharSequenceIterator(CharSequence chars, int start, int end) {
        reset(chars, start, end);
    }

    /**
     * Reset the iterated range to given values.
     * @param chars to iterate in
     * @param start index into chars (inclusive)
     * @param end index into chars (exclusive)
     */
    public void reset(CharSequence chars, int start, int end) {
        assert chars != null;
        assert start <= end;
        assert end <= chars.length();

        this.chars = chars;
        this.start = start;
        this.end = end;

        this.position = start;
    }

    @Override
    public char first() {
        position = start;
        if (position == end) {
            return DONE;
        }
        return chars.charAt(position);
    }

    @Override
    public char last() {
        position = end - 1;
        if (position < start) {
            position = end;
            return DONE;
        }
        return chars.charAt(position);
    }

    @Override
    public char current() {
        if (position < start || position >= end) {
            return DONE;
        }
        return chars.charAt(position);
    }

    @Override
    public char next() {
        if (++position >= end) {
            position = end;
            return DONE;
        }
        return chars.charAt(position);
    }

    @Override
    public char previous() {
        if (position <= start) {
            position = start;
            return DONE;
        }
        return chars.charAt(--position);
    }

    @Override
    public char setIndex(int position) {
        if (position < start || position > end) {
            throw new IllegalArgumentException(position+" outside valid range of ["+start+", "+end+"]");
        }
        this.position = position;
        if (position < end) {
            return chars.charAt(position);
        } else {
            return DONE;
        }
    }

    @Override
    public int getBeginIndex() {
        return start;
    }

    @Override
    public int getEndIndex() {
        return end;
    }

    @Override
    public int getIndex() {
        return position;
    }

    @SuppressWarnings("MethodDoesntCallSuperMethod")
    @Override
    public CharSequenceIterator clone() {
        final CharSequenceIterator clone = new CharSequenceIterator();
        clone.chars = this.chars;
        clone.start = this.start;
        clone.end = this.end;
        clone.position = this.position;
        return clone;
    }
}
