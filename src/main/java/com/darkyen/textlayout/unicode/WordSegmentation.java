package com.darkyen.textlayout.unicode;

import com.badlogic.gdx.utils.Array;
import com.darkyen.textlayout.util.CharSequenceIterator;
import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;

/**
 * Word segmentation according to <a href="https://www.unicode.org/reports/tr29/#Word_Boundaries">UAX #29</a>.
 * Segments which contain a letter or a digit are words, everything else (whitespace, punctuation) is not.
 */
public final class WordSegmentation {

    private static final BreakIterator PROTOTYPE = BreakIterator.getWordInstance(ULocale.ROOT);

    private WordSegmentation() {
    }

    private static BreakIterator iterator(CharSequence text) {
        final BreakIterator iterator = (BreakIterator) PROTOTYPE.clone();
        iterator.setText(new CharSequenceIterator(text, 0, text.length()));
        return iterator;
    }

    /**
     * @return true if text in [start, end) contains a letter or a digit
     */
    public static boolean isWord(CharSequence text, int start, int end) {
        for (int i = start; i < end; ) {
            final int codePoint = Character.codePointAt(text, i);
            if (Character.isLetterOrDigit(codePoint)) {
                return true;
            }
            i += Character.charCount(codePoint);
        }
        return false;
    }

    /**
     * @return ordered segments covering the whole text
     */
    public static Array<WordBoundary> compute(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        final Array<WordBoundary> result = new Array<>(WordBoundary.class);
        if (text.length() == 0) {
            return result;
        }

        final BreakIterator iterator = iterator(text);
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; end = iterator.next()) {
            result.add(new WordBoundary(start, end, isWord(text, start, end) ? WordBoundary.Kind.WORD : WordBoundary.Kind.NON_WORD));
            start = end;
        }
        return result;
    }

    /**
     * @return segment which contains the offset, or which starts at it, null if offset is at or past the end of the text
     */
    public static WordBoundary segmentAt(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset >= length) {
            return null;
        }
        if (offset < 0) offset = 0;

        final BreakIterator iterator = iterator(text);
        final int end = iterator.following(offset);
        final int start = iterator.previous();
        assert start <= offset && offset < end;
        return new WordBoundary(start, end, isWord(text, start, end) ? WordBoundary.Kind.WORD : WordBoundary.Kind.NON_WORD);
    }

    /**
     * @return start of the last word which starts strictly before offset, or 0 if there is none
     */
    public static int previousWordStart(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset > length) offset = length;
        if (offset <= 0) return 0;

        final BreakIterator iterator = iterator(text);
        int start = iterator.preceding(offset);
        while (start != BreakIterator.DONE) {
            final int end = iterator.following(start);
            if (isWord(text, start, end)) {
                return start;
            }
            start = iterator.preceding(start);
        }
        return 0;
    }

    /**
     * @return end of the first word which ends strictly after offset, or length of the text if there is none
     */
    public static int nextWordEnd(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset >= length) return length;
        if (offset < 0) offset = 0;

        final BreakIterator iterator = iterator(text);
        int end = iterator.following(offset);
        int start = iterator.previous();
        while (end != BreakIterator.DONE) {
            if (isWord(text, start, end)) {
                return end;
            }
            start = end;
            end = iterator.following(start);
        }
        return length;
    }
}
