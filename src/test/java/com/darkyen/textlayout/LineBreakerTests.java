package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.textlayout.bidi.BaseDirection;
import com.darkyen.textlayout.bidi.BidiResolver;
import com.darkyen.textlayout.font.FontMetrics;
import com.darkyen.textlayout.unicode.Graphemes;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineBreakerTests {

    static final String HEBREW = "\u05D0\u05D1\u05D2";

    static Array<LineBox<TestFont>> layout(String text, float maxWidth, WrapMode wrapMode) {
        final LayoutParams<TestFont> params = new LayoutParams<>(TestFont.REGULAR, 10f, maxWidth, wrapMode, BaseDirection.AUTO);
        return new LineBreaker<>(TestShaper.INSTANCE, params).layout(text);
    }

    static void assertLines(Array<LineBox<TestFont>> lines, int... boundaries) {
        assertEquals(boundaries.length - 1, lines.size, "Line count: " + lines);
        for (int i = 0; i < lines.size; i++) {
            assertEquals(boundaries[i], lines.get(i).start, "Start of line " + i);
            assertEquals(boundaries[i + 1], lines.get(i).end, "End of line " + i);
        }
    }

    static void assertStops(LineBox<?> line, int... offsets) {
        assertEquals(offsets.length, line.getStopCount(), "Stop count");
        for (int i = 0; i < offsets.length; i++) {
            assertEquals(offsets[i], line.getStopOffset(i), "Offset of slot " + i);
            assertEquals(i * 10f, line.getStopX(i), 1e-4f, "X of slot " + i);
        }
    }

    @Test
    public void emptyTextTest() {
        final Array<LineBox<TestFont>> lines = layout("", 100f, WrapMode.BREAK_WORD);
        assertLines(lines, 0, 0);
        final LineBox<TestFont> line = lines.first();
        assertEquals(10f, line.height);
        assertEquals(8f, line.baselineOffset);
        assertEquals(0f, line.width);
        assertEquals(0, line.runs.size);
        assertEquals(1, line.getStopCount());
        assertEquals(0, line.getStopOffset(0));
    }

    @Test
    public void hardBreaksTest() {
        final Array<LineBox<TestFont>> lines = layout("a\nb\r\nc\n", Float.POSITIVE_INFINITY, WrapMode.NO_WRAP);
        assertLines(lines, 0, 2, 5, 7, 7);
        assertEquals(1, lines.get(0).breakLength);
        assertEquals(2, lines.get(1).breakLength);
        assertEquals(3, lines.get(1).contentEnd());
        assertTrue(lines.get(2).endsWithHardBreak());
        assertFalse(lines.get(3).endsWithHardBreak());
        for (int i = 0; i < lines.size; i++) {
            assertEquals(i * 10f, lines.get(i).yOffset, "Y of line " + i);
        }
        assertEquals(10f, lines.get(1).width, "Line break has no width");
    }

    @Test
    public void wrapAtWordsTest() {
        final Array<LineBox<TestFont>> lines = layout("hello world", 60f, WrapMode.BREAK_WORD);
        assertLines(lines, 0, 6, 11);
        assertEquals(60f, lines.get(0).width);
        assertEquals(50f, lines.get(0).visibleWidth);
        assertEquals(10f, lines.get(1).yOffset);
        assertEquals(18f, lines.get(1).baselineY());
        assertEquals(20f, lines.get(1).bottomY());
    }

    @Test
    public void trailingWhitespaceDoesNotCauseWrapTest() {
        assertLines(layout("hello world", 50f, WrapMode.BREAK_WORD), 0, 6, 11);
    }

    @Test
    public void noWrapTest() {
        assertLines(layout("hello world", 30f, WrapMode.NO_WRAP), 0, 11);
        assertLines(layout("hello world", 0f, WrapMode.BREAK_WORD), 0, 11);
        assertLines(layout("hello world", Float.POSITIVE_INFINITY, WrapMode.BREAK_ALL), 0, 11);
    }

    @Test
    public void longWordFallsBackToGraphemesTest() {
        assertLines(layout("abcdefghij", 35f, WrapMode.BREAK_WORD), 0, 3, 6, 9, 10);
        assertLines(layout("ab abcdefghij", 35f, WrapMode.BREAK_WORD), 0, 3, 6, 9, 12, 13);
    }

    @Test
    public void atLeastOneGraphemePerLineTest() {
        final String text = "ab" + "e\u0301";
        assertLines(layout(text, 5f, WrapMode.BREAK_WORD), 0, 1, 2, 4);
    }

    @Test
    public void breakAllTest() {
        assertLines(layout("hello world", 45f, WrapMode.BREAK_ALL), 0, 4, 8, 11);
    }

    @Test
    public void widthAndCoveragePropertyTest() {
        final String[] texts = {
                "The quick brown fox jumps over the lazy dog",
                "Supercalifragilisticexpialidocious is long\nand so\r\nis this",
                HEBREW + " abc " + HEBREW + HEBREW + " def ghi",
                "a\n\n\nb ",
                "\uD83D\uDC68\u200D\uD83D\uDC69\u200D\uD83D\uDC67\u200D\uD83D\uDC66 emoji \uD83D\uDC68\u200D\uD83D\uDC69\u200D\uD83D\uDC67\u200D\uD83D\uDC66 text",
        };
        for (String text : texts) {
            for (WrapMode mode : WrapMode.values()) {
                for (float maxWidth : new float[]{5f, 25f, 40f, 75f, 1000f}) {
                    final Array<LineBox<TestFont>> lines = layout(text, maxWidth, mode);
                    int expectedStart = 0;
                    float expectedY = 0f;
                    for (LineBox<TestFont> line : lines) {
                        assertEquals(expectedStart, line.start, text);
                        assertEquals(expectedY, line.yOffset, 1e-3f, text);
                        assertTrue(Graphemes.isBoundary(text, line.end), text);
                        if (mode != WrapMode.NO_WRAP && line.visibleWidth > maxWidth) {
                            assertEquals(1, visibleGraphemes(text, line), "Only a single grapheme may overflow: " + line);
                        }
                        expectedStart = line.end;
                        expectedY += line.height;
                    }
                    assertEquals(text.length(), expectedStart, text);
                }
            }
        }
    }

    private static int visibleGraphemes(String text, LineBox<?> line) {
        final IntArray boundaries = new IntArray();
        Graphemes.boundaries(text, line.start, line.contentEnd(), boundaries);
        int count = 0;
        for (int i = 0; i < boundaries.size - 1; i++) {
            if (!Character.isWhitespace(text.codePointAt(boundaries.get(i)))) count++;
        }
        return count;
    }

    @Test
    public void ltrCaretStopsTest() {
        final LineBox<TestFont> line = layout("abc " + HEBREW, 1000f, WrapMode.NO_WRAP).first();
        assertStops(line, 0, 1, 2, 3, 7, 6, 5, 4);
        assertEquals(0, line.paragraphLevel);
        assertEquals(40f, line.xOfOffset(7));
        assertEquals(70f, line.xOfOffset(4));
        assertEquals(7, line.getGraphemeCount());
        assertEquals(6, line.getGraphemeStart(4));
    }

    @Test
    public void rtlCaretStopsTest() {
        final LineBox<TestFont> line = layout(HEBREW + " abc", 1000f, WrapMode.NO_WRAP).first();
        assertEquals(1, line.paragraphLevel);
        assertStops(line, 4, 5, 6, 7, 3, 2, 1, 0);
        assertEquals(4, line.visualStartOffset());
        assertEquals(0, line.visualEndOffset());
    }

    @Test
    public void embeddedRtlCaretStopsTest() {
        final LineBox<TestFont> line = layout("abc " + HEBREW + " def", 1000f, WrapMode.NO_WRAP).first();
        assertStops(line, 0, 1, 2, 3, 7, 6, 5, 4, 8, 9, 10, 11);
        assertEquals(3, line.runs.size);
        assertFalse(line.runs.get(1).isLtr());
        assertEquals(40f, line.runs.get(1).x);
    }

    @Test
    public void fontFallbackTest() {
        final TestFont fallback = new TestFont("fallback", new FontMetrics(16f, 4f, 0f, 10f, 12f, 8f), codePoint -> true, null);
        final TestFont latin = new TestFont("latin", new FontMetrics(8f, 2f, 0f, 10f, 7f, 5f), codePoint -> codePoint < 0x80, fallback);
        final LayoutParams<TestFont> params = new LayoutParams<>(latin, 10f);

        final Array<LineBox<TestFont>> lines = new LineBreaker<>(TestShaper.INSTANCE, params).layout("ab " + HEBREW + "\nab");
        final LineBox<TestFont> mixed = lines.get(0);
        assertEquals(2, mixed.runs.size);
        assertSame(latin, mixed.runs.get(0).font);
        assertSame(fallback, mixed.runs.get(1).font);
        assertEquals(20f, mixed.height);
        assertEquals(16f, mixed.baselineOffset);

        final LineBox<TestFont> plain = lines.get(1);
        assertEquals(10f, plain.height);
        assertEquals(20f, plain.yOffset);
    }

    @Test
    public void lineSeparatorKeepsBidiParagraphTest() {
        final String text = "\u05D0\u05D1\u2028abc";
        final Array<LineBox<TestFont>> lines = layout(text, Float.POSITIVE_INFINITY, WrapMode.NO_WRAP);
        assertLines(lines, 0, 3, 6);
        assertEquals(1, lines.get(0).breakLength);

        // The line separator ends a line, the bidi paragraph goes on
        final byte level = BidiResolver.paragraphs(text, BaseDirection.AUTO).first().level;
        assertEquals(1, level);
        assertEquals(level, lines.get(0).paragraphLevel);
        assertEquals(level, lines.get(1).paragraphLevel);
        assertEquals(1, lines.get(1).runs.size);
        assertEquals(2, lines.get(1).runs.first().level);
    }

    @Test
    public void paragraphSeparatorInsideLineTest() {
        final Array<LineBox<TestFont>> lines = layout("abc\u001C" + HEBREW, Float.POSITIVE_INFINITY, WrapMode.NO_WRAP);
        assertLines(lines, 0, 7);
        final LineBox<TestFont> line = lines.first();
        assertEquals(0, line.paragraphLevel);
        assertEquals(2, line.runs.size);
        assertTrue(line.runs.get(0).isLtr());
        assertEquals(0, line.runs.get(0).start);
        assertFalse(line.runs.get(1).isLtr());
        assertEquals(4, line.runs.get(1).start);
        assertEquals(40f, line.runs.get(1).x);
        assertStops(line, 0, 1, 2, 3, 7, 6, 5, 4);
    }

    @Test
    public void wrappedLinesOfParagraphsTest() {
        // First bidi paragraph ends inside the first line, the second spans the wrapped lines
        final Array<LineBox<TestFont>> lines = layout("a\u001C" + HEBREW + " " + HEBREW, 60f, WrapMode.BREAK_WORD);
        assertLines(lines, 0, 6, 9);
        assertEquals(0, lines.get(0).paragraphLevel);
        assertEquals(1, lines.get(1).paragraphLevel);
    }
}
