package com.darkyen.textlayout;

import com.darkyen.textlayout.bidi.BaseDirection;
import org.junit.jupiter.api.Test;

import static com.darkyen.textlayout.TextLayoutEditingTests.FAMILY;
import static com.darkyen.textlayout.TextLayoutEditingTests.plain;
import static com.darkyen.textlayout.TextLayoutEditingTests.wrapped;
import static org.junit.jupiter.api.Assertions.*;

public class CursorMovementTests {

    @Test
    public void clusterIsSkippedAtomicallyTest() {
        final String text = "Hello " + FAMILY + " World";
        final int before = 6;
        final int after = before + FAMILY.length();
        assertEquals(after, CursorMovement.nextGrapheme(text, before));
        assertEquals(before, CursorMovement.previousGrapheme(text, after));

        final TextLayout<TestFont> layout = plain(text);
        assertEquals(after, layout.moveCursorRight(before));
        assertEquals(before, layout.moveCursorLeft(after));
    }

    @Test
    public void movementAtEdgesTest() {
        final String text = "abc";
        assertEquals(0, CursorMovement.previousGrapheme(text, 0));
        assertEquals(3, CursorMovement.nextGrapheme(text, 3));
        assertEquals(0, CursorMovement.previousGrapheme(text, -10));
        assertEquals(3, CursorMovement.nextGrapheme(text, 10));
        assertEquals(0, CursorMovement.wordLeft(text, 0));
        assertEquals(3, CursorMovement.wordRight(text, 3));

        assertEquals(0, CursorMovement.previousGrapheme("", 0));
        assertEquals(0, CursorMovement.nextGrapheme("", 0));
    }

    @Test
    public void crLfIsSingleStepTest() {
        final String text = "a\r\nb";
        assertEquals(3, CursorMovement.nextGrapheme(text, 1));
        assertEquals(1, CursorMovement.previousGrapheme(text, 3));
    }

    @Test
    public void wordMovementTest() {
        final TextLayout<TestFont> layout = plain("Hello, world! Test");
        assertEquals(5, layout.moveWordRight(0));
        assertEquals(12, layout.moveWordRight(5));
        assertEquals(18, layout.moveWordRight(12));
        assertEquals(18, layout.moveWordRight(18));

        assertEquals(14, layout.moveWordLeft(18));
        assertEquals(7, layout.moveWordLeft(14));
        assertEquals(0, layout.moveWordLeft(7));
        assertEquals(0, layout.moveWordLeft(0));
    }

    @Test
    public void hardLineMovementTest() {
        final String text = "ab\r\ncd\n";
        assertEquals(0, CursorMovement.moveLeft(text, 2, MovementUnit.LINE));
        assertEquals(2, CursorMovement.moveRight(text, 1, MovementUnit.LINE));
        assertEquals(4, CursorMovement.moveLeft(text, 5, MovementUnit.LINE));
        assertEquals(6, CursorMovement.moveRight(text, 4, MovementUnit.LINE));
        assertEquals(7, CursorMovement.moveRight(text, 7, MovementUnit.LINE));
        assertEquals(0, CursorMovement.moveLeft(text, 5, MovementUnit.DOCUMENT));
        assertEquals(7, CursorMovement.moveRight(text, 1, MovementUnit.DOCUMENT));
    }

    @Test
    public void visualLineMovementTest() {
        final TextLayout<TestFont> layout = wrapped("hello world", 60f);
        assertEquals(6, layout.moveLineEnd(2));
        assertEquals(0, layout.moveLineStart(2));
        assertEquals(6, layout.moveLineStart(8));
        assertEquals(11, layout.moveLineEnd(6));
        assertEquals(Affinity.UPSTREAM, layout.affinityOnLine(0, 6));
        assertEquals(Affinity.DOWNSTREAM, layout.affinityOnLine(1, 6));
        assertEquals(Affinity.DOWNSTREAM, layout.affinityOnLine(1, 11));

        assertEquals(0, layout.moveDocumentStart(8));
        assertEquals(11, layout.moveDocumentEnd(2));
    }

    @Test
    public void rtlLineMovementTest() {
        final TextLayout<TestFont> layout = plain(LineBreakerTests.HEBREW + " abc");
        assertEquals(4, layout.moveLineStart(5));
        assertEquals(0, layout.moveLineEnd(5));

        layout.setParams(layout.getParams().withBaseDirection(BaseDirection.RTL));
        assertEquals(4, layout.moveLineStart(1));
        assertEquals(0, layout.moveLineEnd(1));
    }

    @Test
    public void verticalMovementTest() {
        final TextLayout<TestFont> layout = plain("abcdef\nab\nabcdef");

        final VerticalMove down = layout.moveCursorDown(5, Float.NaN);
        assertEquals(9, down.offset);
        assertEquals(50f, down.preferredX);

        final VerticalMove down2 = layout.moveCursorDown(down.offset, down.preferredX);
        assertEquals(15, down2.offset);

        final VerticalMove up = layout.moveCursorUp(15, Float.NaN);
        assertEquals(9, up.offset);
        assertEquals(50f, up.preferredX);

        final VerticalMove top = layout.moveCursorUp(3, Float.NaN);
        assertEquals(0, top.offset);
        assertEquals(30f, top.preferredX);

        final VerticalMove bottom = layout.moveCursorDown(12, Float.NaN);
        assertEquals(16, bottom.offset);
        assertEquals(20f, bottom.preferredX);
    }

    @Test
    public void verticalMovementFromSoftWrapEndTest() {
        final TextLayout<TestFont> layout = wrapped("hello world again", 60f);
        assertEquals(3, layout.getLineCount());
        // Offset 6 at the end of the first line
        final VerticalMove down = layout.moveCursorDown(6, Affinity.UPSTREAM, Float.NaN);
        assertEquals(60f, down.preferredX);
        assertEquals(12, down.offset);
        // The same offset at the start of the second line
        final VerticalMove downstream = layout.moveCursorDown(6, Affinity.DOWNSTREAM, Float.NaN);
        assertEquals(0f, downstream.preferredX);
        assertEquals(12, downstream.offset);
        assertEquals(0, layout.moveCursorUp(6, Affinity.UPSTREAM, Float.NaN).offset);
        assertEquals(0, layout.moveCursorUp(6, Affinity.DOWNSTREAM, Float.NaN).offset);
    }
}
