package com.darkyen.textlayout.unicode;

import com.badlogic.gdx.utils.Array;
import com.darkyen.textlayout.util.CharSequenceIterator;
import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;

/**
 * Line break opportunities according to <a href="https://www.unicode.org/reports/tr14/">UAX #14</a>
 * and helpers for hard line breaks, which split the text into paragraphs.
 */
public final class LineBreaking {

    private static final BreakIterator PROTOTYPE = BreakIterator.getLineInstance(ULocale.ROOT);

    private LineBreaking() {
    }

    /**
     * @return true if c forces a line break after itself (LF, CR, VT, FF, NEL, LS, PS)
     */
    public static boolean isHardBreak(char c) {
        switch (c) {
            case '\n':
            case '\r':
            case '\u000B':
            case '\u000C':
            case '\u0085':
            case '\u2028':
            case '\u2029':
                return true;
            default:
                return false;
        }
    }

    /**
     * @return length of the hard line break which ends right before end (2 for CRLF), or 0 if there is no such break
     */
    public static int hardBreakLengthBefore(CharSequence text, int end) {
        if (end <= 0) return 0;
        final char last = text.charAt(end - 1);
        if (last == '\n' && end >= 2 && text.charAt(end - 2) == '\r') {
            return 2;
        }
        return isHardBreak(last) ? 1 : 0;
    }

    /**
     * @return start of the paragraph (text between hard line breaks) which contains offset
     */
    public static int paragraphStart(CharSequence text, int offset) {
        int i = Math.min(offset, text.length());
        while (i > 0 && !isHardBreak(text.charAt(i - 1))) {
            i--;
        }
        return Math.max(i, 0);
    }

    /**
     * @return end of the paragraph which contains offset, after its hard line break, if any
     */
    public static int paragraphEnd(CharSequence text, int offset) {
        final int length = text.length();
        for (int i = Math.max(offset, 0); i < length; i++) {
            final char c = text.charAt(i);
            if (isHardBreak(c)) {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    return i + 2;
                }
                return i + 1;
            }
        }
        return length;
    }

    /**
     * @return all break opportunities of the text, the end of non-empty text is always a mandatory break
     */
    public static Array<LineBreak> compute(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        final Array<LineBreak> result = new Array<>(LineBreak.class);
        compute(text, 0, text.length(), result);
        return result;
    }

    /**
     * Add break opportunities of text in (start, end] to out.
     * The range should start and end at paragraph boundaries.
     */
    public static void compute(CharSequence text, int start, int end, Array<LineBreak> out) {
        if (text == null) throw new NullPointerException("text");
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("["+start+", "+end+") not in [0, "+text.length()+")");
        }
        if (start == end) {
            return;
        }

        final BreakIterator iterator = (BreakIterator) PROTOTYPE.clone();
        iterator.setText(new CharSequenceIterator(text, start, end));
        iterator.first();
        final int length = text.length();
        for (int b = iterator.next(); b != BreakIterator.DONE; b = iterator.next()) {
            final boolean mandatory = b == length || isHardBreak(text.charAt(b - 1));
            out.add(new LineBreak(b, mandatory ? LineBreak.Kind.MANDATORY : LineBreak.Kind.OPPORTUNITY));
        }
    }
}
