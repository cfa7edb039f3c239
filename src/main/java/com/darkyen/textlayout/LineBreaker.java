package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.FloatArray;
import com.badlogic.gdx.utils.IntArray;
import com.badlogic.gdx.utils.IntSet;
import com.darkyen.textlayout.bidi.BaseDirection;
import com.darkyen.textlayout.bidi.BidiResolver;
import com.darkyen.textlayout.bidi.BidiRun;
import com.darkyen.textlayout.bidi.ParagraphBidi;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.FontMetrics;
import com.darkyen.textlayout.font.ShapedRun;
import com.darkyen.textlayout.font.Shaper;
import com.darkyen.textlayout.unicode.Graphemes;
import com.darkyen.textlayout.unicode.LineBreak;
import com.darkyen.textlayout.unicode.LineBreaking;

import java.util.Arrays;

/**
 * Splits text into {@link LineBox}es.
 *
 * Each hard paragraph (text up to and including a hard line break) is wrapped on its own. Lines are then resolved
 * by bidi, split into runs of a single font and level and shaped.
 * Bidi levels come from bidi paragraphs, which end only at paragraph separators (B). A line separator or a form feed
 * ends a line, but not its bidi paragraph, while a B which is not a hard break (U+001C..U+001E) ends the bidi paragraph
 * inside of a line. Such line shows the runs of its bidi paragraphs in logical order of the paragraphs.
 */
public final class LineBreaker <F extends Font<F>> {

    private final Shaper<F> shaper;
    private final LayoutParams<F> params;

    /* Reused by a single layout pass, this object is not thread safe. */
    private final IntArray candidates = new IntArray();
    private final IntArray graphemes = new IntArray();
    private final Array<LineBreak> lineBreaks = new Array<>(LineBreak.class);
    /* advancePrefix[i] = advance of paragraph chars before paragraphStart + i */
    private final FloatArray advancePrefix = new FloatArray();

    public LineBreaker(Shaper<F> shaper, LayoutParams<F> params) {
        if (shaper == null) throw new NullPointerException("shaper");
        if (params == null) throw new NullPointerException("params");
        this.shaper = shaper;
        this.params = params;
    }

    /**
     * Lay out the whole text.
     * @return lines covering the whole text, at least one
     */
    public Array<LineBox<F>> layout(CharSequence text) {
        final Array<LineBox<F>> lines = new Array<>();
        layoutParagraphs(text, 0, text.length(), 0f, lines);
        return lines;
    }

    /**
     * Lay out paragraphs in [start, end) and add them to out.
     * Both start and end must be paragraph boundaries. When end is the end of the text and the text is empty or ends
     * with a hard line break, the empty last line is added as well.
     *
     * @param y top of the first line
     * @return bottom of the last added line
     */
    public float layoutParagraphs(CharSequence text, int start, int end, float y, Array<LineBox<F>> out) {
        final int length = text.length();
        int paragraphStart = start;
        BidiParagraphs bidi = null;
        while (paragraphStart < end) {
            final int paragraphEnd = LineBreaking.paragraphEnd(text, paragraphStart);
            assert paragraphEnd <= end : "Paragraph [" + paragraphStart + ", " + paragraphEnd + ") crosses " + end;
            if (bidi == null || !bidi.covers(paragraphStart, paragraphEnd)) {
                bidi = new BidiParagraphs(text, paragraphStart, paragraphEnd, params.baseDirection);
            }
            y = layoutParagraph(text, bidi, paragraphStart, paragraphEnd, y, out);
            paragraphStart = paragraphEnd;
        }

        if (end == length && (length == 0 || LineBreaking.hardBreakLengthBefore(text, length) > 0)) {
            final BidiParagraphs lastBidi = new BidiParagraphs(text, length, length, params.baseDirection);
            final LineBox<F> line = createLine(text, lastBidi, length, length, 0, y);
            out.add(line);
            y += line.height;
        }
        return y;
    }

    private float layoutParagraph(CharSequence text, BidiParagraphs bidi, int paragraphStart, int paragraphEnd, float y, Array<LineBox<F>> out) {
        final int breakLength = LineBreaking.hardBreakLengthBefore(text, paragraphEnd);
        final int contentEnd = paragraphEnd - breakLength;

        if (contentEnd == paragraphStart || !params.wraps()) {
            final LineBox<F> line = createLine(text, bidi, paragraphStart, contentEnd, breakLength, y);
            out.add(line);
            return y + line.height;
        }

        measure(text, bidi, paragraphStart, contentEnd);

        final IntArray candidates = this.candidates;
        candidates.clear();
        if (params.wrapMode == WrapMode.BREAK_ALL) {
            graphemes.clear();
            Graphemes.boundaries(text, paragraphStart, contentEnd, graphemes);
            candidates.addAll(graphemes, 1, graphemes.size - 1);
        } else {
            lineBreaks.clear();
            LineBreaking.compute(text, paragraphStart, paragraphEnd, lineBreaks);
            for (LineBreak lineBreak : lineBreaks) {
                candidates.add(Math.min(lineBreak.offset, contentEnd));
            }
            if (candidates.size == 0 || candidates.peek() != contentEnd) {
                candidates.add(contentEnd);
            }
        }

        final float maxWidth = params.maxWidth;
        int lineStart = paragraphStart;
        int candidate = 0;
        while (lineStart < contentEnd) {
            while (candidates.get(candidate) <= lineStart) {
                candidate++;
            }

            int lastFitting = candidate - 1;
            for (int c = candidate; c < candidates.size; c++) {
                if (measuredWidth(text, paragraphStart, lineStart, candidates.get(c)) <= maxWidth) {
                    lastFitting = c;
                } else {
                    break;
                }
            }

            // Shaping the line on its own may differ from the measure (tab stops), so the line must fit as shaped
            LineBox<F> line = null;
            for (int c = lastFitting; c >= candidate && line == null; c--) {
                line = fittingLine(text, bidi, lineStart, candidates.get(c), contentEnd, breakLength, y);
            }

            if (line == null) {
                // Leading token is too wide, break it between graphemes
                final int tokenEnd = candidates.get(candidate);
                graphemes.clear();
                Graphemes.boundaries(text, lineStart, tokenEnd, graphemes);
                int g = 1;
                while (g + 1 < graphemes.size && measuredWidth(text, paragraphStart, lineStart, graphemes.get(g + 1)) <= maxWidth) {
                    g++;
                }
                for (; g > 1 && line == null; g--) {
                    line = fittingLine(text, bidi, lineStart, graphemes.get(g), contentEnd, breakLength, y);
                }
                if (line == null) {
                    // At least one grapheme, always
                    final int lineEnd = graphemes.get(1);
                    line = createLine(text, bidi, lineStart, lineEnd, lineEnd == contentEnd ? breakLength : 0, y);
                }
            }

            final int lineEnd = line.contentEnd();
            out.add(line);
            y += line.height;
            lineStart = lineEnd;
        }
        return y;
    }

    /** @return line [lineStart, lineEnd) if its visible width fits, null otherwise */
    private LineBox<F> fittingLine(CharSequence text, BidiParagraphs bidi, int lineStart, int lineEnd, int contentEnd, int breakLength, float y) {
        final LineBox<F> line = createLine(text, bidi, lineStart, lineEnd, lineEnd == contentEnd ? breakLength : 0, y);
        return line.visibleWidth <= params.maxWidth ? line : null;
    }

    /**
     * Shape the whole paragraph in logical order, to measure candidate lines.
     */
    private void measure(CharSequence text, BidiParagraphs bidi, int paragraphStart, int contentEnd) {
        final FloatArray prefix = this.advancePrefix;
        prefix.clear();
        final float[] advances = prefix.ensureCapacity(contentEnd - paragraphStart + 1);
        prefix.size = contentEnd - paragraphStart + 1;
        Arrays.fill(advances, 0, prefix.size, 0f);

        int runStart = paragraphStart;
        while (runStart < contentEnd) {
            final byte level = bidi.levelAt(runStart);
            int runEnd = runStart + 1;
            while (runEnd < contentEnd && bidi.levelAt(runEnd) == level) {
                runEnd++;
            }
            final Array<FontPiece<F>> pieces = itemize(text, runStart, runEnd);
            for (FontPiece<F> piece : pieces) {
                final ShapedRun<F> run = shaper.shape(text, piece.start, piece.end, piece.font, params.fontSize, level);
                for (int g = 0; g < run.size(); g++) {
                    advances[run.start + run.clusters.get(g) - paragraphStart + 1] += run.advances.get(g);
                }
            }
            runStart = runEnd;
        }

        final float[] items = prefix.items;
        for (int i = 1; i < prefix.size; i++) {
            items[i] += items[i - 1];
        }
    }

    /**
     * @return width of [from, to) without its trailing whitespace, according to the last {@link #measure}
     */
    private float measuredWidth(CharSequence text, int paragraphStart, int from, int to) {
        int trimmed = to;
        while (trimmed > from && Character.isWhitespace(text.charAt(trimmed - 1))) {
            trimmed--;
        }
        final float[] prefix = advancePrefix.items;
        return prefix[trimmed - paragraphStart] - prefix[from - paragraphStart];
    }

    /**
     * Bidi paragraphs which cover a range of text. The first and last may extend outside of it,
     * to resolve the range with the same levels as the whole text.
     */
    private static final class BidiParagraphs {
        final Array<ParagraphBidi> paragraphs = new Array<>(true, 2, ParagraphBidi.class);

        BidiParagraphs(CharSequence text, int start, int end, BaseDirection base) {
            int paragraphStart = BidiResolver.paragraphStart(text, start);
            while (true) {
                final int paragraphEnd = BidiResolver.paragraphEnd(text, paragraphStart);
                paragraphs.add(BidiResolver.resolveParagraph(text, paragraphStart, paragraphEnd, base));
                if (paragraphEnd >= end) break;
                paragraphStart = paragraphEnd;
            }
        }

        boolean covers(int start, int end) {
            return paragraphs.first().start <= start && end <= paragraphs.peek().end;
        }

        ParagraphBidi containing(int index) {
            for (int i = paragraphs.size - 1; i > 0; i--) {
                final ParagraphBidi paragraph = paragraphs.get(i);
                if (paragraph.start <= index) return paragraph;
            }
            return paragraphs.first();
        }

        byte levelAt(int index) {
            return containing(index).levelAt(index);
        }

        /** @return runs of the line in visual order */
        Array<BidiRun> visualRuns(int lineStart, int lineEnd) {
            if (paragraphs.size == 1) {
                return paragraphs.first().visualRuns(lineStart, lineEnd).runs;
            }
            final Array<BidiRun> runs = new Array<>(true, 4, BidiRun.class);
            for (ParagraphBidi paragraph : paragraphs) {
                final int from = Math.max(lineStart, paragraph.start);
                final int to = Math.min(lineEnd, paragraph.end);
                if (from < to) {
                    runs.addAll(paragraph.visualRuns(from, to).runs);
                }
            }
            return runs;
        }
    }

    /** Range of text displayed by a single font. */
    private static final class FontPiece <F extends Font<F>> {
        final int start, end;
        final F font;

        FontPiece(int start, int end, F font) {
            this.start = start;
            this.end = end;
            this.font = font;
        }
    }

    /**
     * Split [start, end) into pieces with single font each, the first font of the fallback chain which has the
     * first code point of the grapheme is used. Whitespace and invisible characters stay with the font before them.
     * @return pieces in logical order
     */
    private Array<FontPiece<F>> itemize(CharSequence text, int start, int end) {
        final Array<FontPiece<F>> pieces = new Array<>();
        final F primary = params.font;
        final IntArray boundaries = new IntArray();
        Graphemes.boundaries(text, start, end, boundaries);

        F currentFont = null;
        int pieceStart = start;
        for (int i = 0; i < boundaries.size - 1; i++) {
            final int graphemeStart = boundaries.get(i);
            final int codePoint = Character.codePointAt(text, graphemeStart);

            final F font;
            if (currentFont != null && isTransparent(codePoint)) {
                font = currentFont;
            } else {
                font = fontFor(primary, codePoint);
            }

            if (currentFont != null && font != currentFont) {
                pieces.add(new FontPiece<>(pieceStart, graphemeStart, currentFont));
                pieceStart = graphemeStart;
            }
            currentFont = font;
        }
        if (pieceStart < end) {
            pieces.add(new FontPiece<>(pieceStart, end, currentFont == null ? primary : currentFont));
        }
        return pieces;
    }

    private static boolean isTransparent(int codePoint) {
        if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) return true;
        final int type = Character.getType(codePoint);
        return type == Character.FORMAT || type == Character.CONTROL;
    }

    private static <F extends Font<F>> F fontFor(F primary, int codePoint) {
        for (F font = primary; font != null; font = font.getFallback()) {
            if (font.hasGlyph(codePoint)) {
                return font;
            }
        }
        return primary;
    }

    /** Visual grapheme of a line, during caret stop assignment. */
    private static final class VisualGrapheme {
        final int start, end;
        final boolean ltr;
        final float left, right;

        VisualGrapheme(int start, int end, boolean ltr, float left, float right) {
            this.start = start;
            this.end = end;
            this.ltr = ltr;
            this.left = left;
            this.right = right;
        }
    }

    /**
     * Shape a single line of the paragraph.
     * @param contentEnd end of the line without the hard line break
     * @param breakLength length of the hard line break after contentEnd
     */
    private LineBox<F> createLine(CharSequence text, BidiParagraphs bidi, int lineStart, int contentEnd, int breakLength, float y) {
        final Array<BidiRun> bidiRuns = bidi.visualRuns(lineStart, contentEnd);
        final Array<ShapedRun<F>> runs = new Array<>(true, bidiRuns.size + 2);

        float x = 0f;
        for (BidiRun bidiRun : bidiRuns) {
            final Array<FontPiece<F>> pieces = itemize(text, bidiRun.start, bidiRun.end);
            final boolean ltr = bidiRun.isLtr();
            for (int p = 0; p < pieces.size; p++) {
                final FontPiece<F> piece = pieces.get(ltr ? p : pieces.size - 1 - p);
                final ShapedRun<F> run = shaper.shape(text, piece.start, piece.end, piece.font, params.fontSize, bidiRun.level);
                run.x = x;
                x += run.width;
                runs.add(run);
            }
        }
        final float width = x;

        int trimmed = contentEnd;
        while (trimmed > lineStart && Character.isWhitespace(text.charAt(trimmed - 1))) {
            trimmed--;
        }
        float trailingWhitespace = 0f;
        if (trimmed < contentEnd) {
            for (ShapedRun<F> run : runs) {
                trailingWhitespace += run.advanceOf(trimmed, contentEnd);
            }
        }

        // Line metrics
        float ascent = 0f, descent = 0f, leading = 0f;
        if (runs.size == 0) {
            final FontMetrics metrics = params.font.getMetrics().scale(params.fontSize);
            ascent = metrics.ascent;
            descent = metrics.descent;
            leading = metrics.lineGap;
        } else {
            for (ShapedRun<F> run : runs) {
                final FontMetrics metrics = run.font.getMetrics().scale(run.fontSize);
                ascent = Math.max(ascent, metrics.ascent);
                descent = Math.max(descent, metrics.descent);
                leading = Math.max(leading, metrics.lineGap);
            }
        }

        // Caret stops
        final Array<VisualGrapheme> visual = new Array<>(true, contentEnd - lineStart);
        final IntArray boundaries = new IntArray();
        for (ShapedRun<F> run : runs) {
            boundaries.clear();
            Graphemes.boundaries(text, run.start, run.end, boundaries);
            final boolean ltr = run.isLtr();
            final int firstVisual = visual.size;
            for (int i = 0; i < boundaries.size - 1; i++) {
                final int gs = boundaries.get(i), ge = boundaries.get(i + 1);
                final float before = run.advanceOf(run.start, gs);
                final float advance = run.advanceOf(gs, ge);
                if (ltr) {
                    final float left = run.x + before;
                    visual.add(new VisualGrapheme(gs, ge, true, left, left + advance));
                } else {
                    final float right = run.x + run.width - before;
                    visual.add(new VisualGrapheme(gs, ge, false, right - advance, right));
                }
            }
            if (!ltr) {
                for (int i = firstVisual, j = visual.size - 1; i < j; i++, j--) {
                    visual.swap(i, j);
                }
            }
        }

        final int graphemeCount = visual.size;
        final int[] stopOffsets = new int[graphemeCount + 1];
        final float[] stopX = new float[graphemeCount + 1];
        final int[] graphemeStarts = new int[graphemeCount];
        if (graphemeCount == 0) {
            stopOffsets[0] = lineStart;
            stopX[0] = 0f;
        } else {
            final IntSet taken = new IntSet(graphemeCount + 1);
            for (int k = 0; k <= graphemeCount; k++) {
                final VisualGrapheme leftOfSlot = k > 0 ? visual.get(k - 1) : null;
                final VisualGrapheme rightOfSlot = k < graphemeCount ? visual.get(k) : null;

                final int preferred = rightOfSlot == null ? -1 : rightOfSlot.ltr ? rightOfSlot.start : rightOfSlot.end;
                final int other = leftOfSlot == null ? -1 : leftOfSlot.ltr ? leftOfSlot.end : leftOfSlot.start;
                final int offset;
                if (preferred != -1 && !taken.contains(preferred)) {
                    offset = preferred;
                } else if (other != -1 && !taken.contains(other)) {
                    offset = other;
                } else {
                    offset = preferred != -1 ? preferred : other;
                }
                taken.add(offset);
                stopOffsets[k] = offset;
                stopX[k] = rightOfSlot != null ? rightOfSlot.left : leftOfSlot.right;
                if (rightOfSlot != null) {
                    graphemeStarts[k] = rightOfSlot.start;
                }
            }
        }

        return new LineBox<>(lineStart, contentEnd + breakLength, breakLength,
                width, width - trailingWhitespace,
                ascent, descent, leading, y,
                bidi.containing(lineStart).level, runs, stopOffsets, stopX, graphemeStarts);
    }
}
