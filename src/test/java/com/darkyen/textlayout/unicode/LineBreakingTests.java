package com.darkyen.textlayout.unicode;

import com.badlogic.gdx.utils.Array;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineBreakingTests {

    @Test
    public void computeTest() {
        final Array<LineBreak> breaks = LineBreaking.compute("ab cd\nef");
        assertEquals(3, breaks.size);
        assertEquals(new LineBreak(3, LineBreak.Kind.OPPORTUNITY), breaks.get(0));
        assertEquals(new LineBreak(6, LineBreak.Kind.MANDATORY), breaks.get(1));
        assertEquals(new LineBreak(8, LineBreak.Kind.MANDATORY), breaks.get(2));
    }

    @Test
    public void endIsAlwaysMandatoryTest() {
        for (String text : new String[]{"a", "hello world", "x\n", "a\r\nb", "\u05D0\u05D1 c"}) {
            final Array<LineBreak> breaks = LineBreaking.compute(text);
            assertTrue(breaks.size > 0, text);
            assertEquals(text.length(), breaks.peek().offset, text);
            assertTrue(breaks.peek().isMandatory(), text);
        }
        assertEquals(0, LineBreaking.compute("").size);
    }

    @Test
    public void crlfIsSingleBreakTest() {
        final Array<LineBreak> breaks = LineBreaking.compute("a\r\nb");
        assertEquals(2, breaks.size);
        assertEquals(new LineBreak(3, LineBreak.Kind.MANDATORY), breaks.get(0));
    }

    @Test
    public void hardBreaksTest() {
        for (char c : new char[]{'\n', '\r', '\u000B', '\u000C', '\u0085', '\u2028', '\u2029'}) {
            assertTrue(LineBreaking.isHardBreak(c), "For " + (int) c);
        }
        assertFalse(LineBreaking.isHardBreak(' '));
        assertFalse(LineBreaking.isHardBreak('\t'));

        assertEquals(2, LineBreaking.hardBreakLengthBefore("a\r\n", 3));
        assertEquals(1, LineBreaking.hardBreakLengthBefore("a\n", 2));
        assertEquals(1, LineBreaking.hardBreakLengthBefore("a\r", 2));
        assertEquals(0, LineBreaking.hardBreakLengthBefore("ab", 2));
        assertEquals(0, LineBreaking.hardBreakLengthBefore("", 0));
    }

    @Test
    public void paragraphsTest() {
        final String text = "one\r\ntwo\nthree";
        assertEquals(0, LineBreaking.paragraphStart(text, 2));
        assertEquals(5, LineBreaking.paragraphEnd(text, 2));
        assertEquals(5, LineBreaking.paragraphStart(text, 5));
        assertEquals(9, LineBreaking.paragraphEnd(text, 5));
        assertEquals(9, LineBreaking.paragraphStart(text, text.length()));
        assertEquals(text.length(), LineBreaking.paragraphEnd(text, 11));

        assertEquals(3, LineBreaking.paragraphStart("ab\n", 3));
        assertEquals(3, LineBreaking.paragraphEnd("ab\n", 3));
    }
}
