package com.darkyen.textlayout;

import com.badlogic.gdx.math.Rectangle;
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.Logger;
import com.darkyen.textlayout.bidi.BaseDirection;
import com.darkyen.textlayout.bidi.BidiResolver;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.Shaper;
import com.darkyen.textlayout.unicode.Graphemes;
import com.darkyen.textlayout.unicode.LineBreaking;
import com.darkyen.textlayout.unicode.WordBoundary;
import com.darkyen.textlayout.unicode.WordSegmentation;

/**
 * Text laid out into lines, together with the operations which map between offsets in the text and positions
 * in the layout, and edits which keep the layout up to date.
 *
 * Coordinates have the origin at the top left corner of the layout, Y goes down.
 * All offsets are char indices into the text. Offsets passed into the queries and edits are never errors,
 * they are clamped into the text and snapped to the grapheme boundary at or before them.
 *
 * Not thread safe.
 *
 * @param <F> font type of the layout
 */
public final class TextLayout <F extends Font<F>> {

    /**
     * Logger of the whole library. Set to {@link Logger#ERROR} by default, raise the level to see relayout and
     * cache activity.
     */
    public static final Logger LOG = new Logger("TextLayout", Logger.ERROR);

    private final Shaper<F> shaper;
    private final LayoutCache<F> cache;
    private LayoutParams<F> params;

    private String text;
    private Array<LineBox<F>> lines;
    private PrefixSums prefixSums;

    public TextLayout(Shaper<F> shaper, CharSequence text, LayoutParams<F> params) {
        this(shaper, text, params, null);
    }

    /**
     * @param cache to share complete layouts with other instances, may be null
     */
    public TextLayout(Shaper<F> shaper, CharSequence text, LayoutParams<F> params, LayoutCache<F> cache) {
        if (shaper == null) throw new NullPointerException("shaper");
        if (text == null) throw new NullPointerException("text");
        if (params == null) throw new NullPointerException("params");
        this.shaper = shaper;
        this.cache = cache;
        this.params = params;
        this.text = text.toString();
        layoutFully();
    }

    /** Create a layout which does not wrap. */
    public static <F extends Font<F>> TextLayout<F> create(Shaper<F> shaper, CharSequence text, F font, float fontSize) {
        return new TextLayout<>(shaper, text, new LayoutParams<>(font, fontSize));
    }

    /** Create a layout which wraps its lines at maxWidth. */
    public static <F extends Font<F>> TextLayout<F> withWrap(Shaper<F> shaper, CharSequence text, F font, float fontSize,
                                                             float maxWidth, WrapMode wrapMode) {
        return new TextLayout<>(shaper, text, new LayoutParams<>(font, fontSize, maxWidth, wrapMode, BaseDirection.AUTO));
    }

    private void layoutFully() {
        final Array<LineBox<F>> lines;
        if (cache != null) {
            lines = cache.getOrLayout(text, params, shaper);
        } else {
            lines = new LineBreaker<>(shaper, params).layout(text);
        }
        setLines(lines);
    }

    private void setLines(Array<LineBox<F>> lines) {
        assert validLines(text, lines);
        this.lines = lines;
        this.prefixSums = new PrefixSums(text, lines);
    }

    private static boolean validLines(String text, Array<? extends LineBox<?>> lines) {
        if (lines.size == 0) return false;
        int expectedStart = 0;
        for (LineBox<?> line : lines) {
            if (line.start != expectedStart) return false;
            expectedStart = line.end;
        }
        return expectedStart == text.length();
    }

    //region Queries

    /** @return current text, never null */
    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public LayoutParams<F> getParams() {
        return params;
    }

    /** Change the params and lay out the whole text again. */
    public void setParams(LayoutParams<F> params) {
        if (params == null) throw new NullPointerException("params");
        this.params = params;
        layoutFully();
    }

    /** Replace the whole text and lay it out again. */
    public void setText(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        this.text = text.toString();
        layoutFully();
    }

    /**
     * @return all lines, at least one. <strong>DO NOT MODIFY</strong>, the array may be shared.
     */
    public Array<LineBox<F>> getLines() {
        return lines;
    }

    public int getLineCount() {
        return lines.size;
    }

    public LineBox<F> getLine(int index) {
        return lines.get(index);
    }

    /** @return width of the widest line */
    public float getWidth() {
        float width = 0f;
        for (LineBox<F> line : lines) {
            width = Math.max(width, line.width);
        }
        return width;
    }

    /** @return total height of all lines */
    public float getHeight() {
        return lines.peek().bottomY();
    }

    public PrefixSums getPrefixSums() {
        return prefixSums;
    }

    public int lineStartOffset(int lineIndex) {
        return prefixSums.lineStart(lineIndex);
    }

    /** @return offset clamped into the text and snapped to a grapheme boundary */
    public int snap(int offset) {
        return Graphemes.snap(text, offset);
    }

    /**
     * @return index of the line with the offset. Offset between two soft-wrapped lines belongs to the
     * previous line when affinity is {@link Affinity#UPSTREAM}, to the next one otherwise.
     */
    public int lineIndexAt(int offset, Affinity affinity) {
        offset = Math.max(0, Math.min(offset, text.length()));
        final int index = prefixSums.lineAt(offset);
        if (affinity == Affinity.UPSTREAM && index > 0 && offset == lines.get(index).start
                && !lines.get(index - 1).endsWithHardBreak()) {
            return index - 1;
        }
        return index;
    }

    private int lineIndexAtY(float y) {
        final Array<LineBox<F>> lines = this.lines;
        int low = 0, high = lines.size - 1;
        int result = 0;
        while (low <= high) {
            final int mid = (low + high) >>> 1;
            if (lines.get(mid).yOffset <= y) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }

    private boolean isSoftWrapEnd(int lineIndex, int offset) {
        final LineBox<F> line = lines.get(lineIndex);
        return offset == line.end && !line.endsWithHardBreak() && lineIndex + 1 < lines.size;
    }

    //endregion

    //region Offsets and positions

    /**
     * @return rectangle of 1px wide caret, null if the offset is not in the text
     */
    public Rectangle cursorRect(CursorPosition position) {
        return cursorRect(position, 1f);
    }

    /**
     * @param caretWidth width of the returned rectangle
     * @return rectangle of the caret, null if the offset is not in the text
     */
    public Rectangle cursorRect(CursorPosition position, float caretWidth) {
        if (position.offset < 0 || position.offset > text.length()) {
            return null;
        }
        final int offset = snap(position.offset);
        final LineBox<F> line = lines.get(lineIndexAt(offset, position.affinity));
        return new Rectangle(line.xOfOffset(offset), line.yOffset, caretWidth, line.height);
    }

    /**
     * @return caret X and line top of the offset, null if the offset is not in the text
     */
    public Position offsetToPosition(int offset) {
        if (offset < 0 || offset > text.length()) {
            return null;
        }
        offset = snap(offset);
        final int lineIndex = lineIndexAt(offset, Affinity.DOWNSTREAM);
        final LineBox<F> line = lines.get(lineIndex);
        return new Position(line.xOfOffset(offset), line.yOffset, lineIndex);
    }

    /**
     * @return caret X and line baseline of the offset, null if the offset is not in the text
     */
    public Position offsetToBaselinePosition(int offset) {
        final Position position = offsetToPosition(offset);
        if (position == null) return null;
        return new Position(position.x, lines.get(position.lineIndex).baselineY(), position.lineIndex);
    }

    /**
     * Find the caret stop nearest to the point.
     * @return hit, or null when the policy is {@link HitTestPolicy#STRICT} and the point is outside of the lines
     */
    public HitTestResult hitTest(float x, float y, HitTestPolicy policy) {
        final boolean strict = policy == HitTestPolicy.STRICT;
        if (text.isEmpty()) {
            return strict ? null : new HitTestResult(0, Affinity.DOWNSTREAM, 0);
        }
        if (strict && (y < 0f || y >= getHeight())) {
            return null;
        }

        final int lineIndex = y < 0f ? 0 : lineIndexAtY(y);
        final LineBox<F> line = lines.get(lineIndex);
        if (strict && (x < 0f || x > line.width)) {
            return null;
        }

        final int offset = line.offsetAtX(x);
        final Affinity affinity = isSoftWrapEnd(lineIndex, offset) ? Affinity.UPSTREAM : Affinity.DOWNSTREAM;
        return new HitTestResult(offset, affinity, lineIndex);
    }

    //endregion

    //region Movement

    /**
     * Move towards the start of the text, by characters or words, or to the visual start of the line.
     */
    public int moveLeft(int offset, MovementUnit unit) {
        if (unit == MovementUnit.LINE) {
            return lines.get(lineIndexAt(snap(offset), Affinity.DOWNSTREAM)).visualStartOffset();
        }
        return CursorMovement.moveLeft(text, offset, unit);
    }

    /**
     * Move towards the end of the text, by characters or words, or to the visual end of the line.
     */
    public int moveRight(int offset, MovementUnit unit) {
        if (unit == MovementUnit.LINE) {
            return lines.get(lineIndexAt(snap(offset), Affinity.DOWNSTREAM)).visualEndOffset();
        }
        return CursorMovement.moveRight(text, offset, unit);
    }

    public int moveCursorLeft(int offset) {
        return moveLeft(offset, MovementUnit.CHARACTER);
    }

    public int moveCursorRight(int offset) {
        return moveRight(offset, MovementUnit.CHARACTER);
    }

    public int moveWordLeft(int offset) {
        return moveLeft(offset, MovementUnit.WORD);
    }

    public int moveWordRight(int offset) {
        return moveRight(offset, MovementUnit.WORD);
    }

    public int moveLineStart(int offset) {
        return moveLeft(offset, MovementUnit.LINE);
    }

    public int moveLineEnd(int offset) {
        return moveRight(offset, MovementUnit.LINE);
    }

    public int moveDocumentStart(int offset) {
        return 0;
    }

    public int moveDocumentEnd(int offset) {
        return text.length();
    }

    /**
     * Move to the previous line, to the caret stop nearest to preferredX.
     * @param preferredX X to keep between vertical moves, NaN to use X of the offset
     */
    public VerticalMove moveCursorUp(int offset, float preferredX) {
        return moveCursorUp(offset, Affinity.DOWNSTREAM, preferredX);
    }

    public VerticalMove moveCursorUp(int offset, Affinity affinity, float preferredX) {
        offset = snap(offset);
        final int lineIndex = lineIndexAt(offset, affinity);
        final float x = Float.isNaN(preferredX) ? lines.get(lineIndex).xOfOffset(offset) : preferredX;
        if (lineIndex == 0) {
            return new VerticalMove(0, x);
        }
        return new VerticalMove(lines.get(lineIndex - 1).offsetAtX(x), x);
    }

    /**
     * Move to the next line, to the caret stop nearest to preferredX.
     * @param preferredX X to keep between vertical moves, NaN to use X of the offset
     */
    public VerticalMove moveCursorDown(int offset, float preferredX) {
        return moveCursorDown(offset, Affinity.DOWNSTREAM, preferredX);
    }

    public VerticalMove moveCursorDown(int offset, Affinity affinity, float preferredX) {
        offset = snap(offset);
        final int lineIndex = lineIndexAt(offset, affinity);
        final float x = Float.isNaN(preferredX) ? lines.get(lineIndex).xOfOffset(offset) : preferredX;
        if (lineIndex == lines.size - 1) {
            return new VerticalMove(text.length(), x);
        }
        return new VerticalMove(lines.get(lineIndex + 1).offsetAtX(x), x);
    }

    /**
     * @return affinity which keeps the caret on the given line, when it is at its soft-wrapped end
     */
    public Affinity affinityOnLine(int lineIndex, int offset) {
        return isSoftWrapEnd(lineIndex, offset) ? Affinity.UPSTREAM : Affinity.DOWNSTREAM;
    }

    //endregion

    //region Selection

    /** @return selection with both ends clamped and snapped */
    public Selection snapSelection(Selection selection) {
        return new Selection(snap(selection.anchor), snap(selection.focus));
    }

    /**
     * @return rectangles covering the selected graphemes, one per visually contiguous part of each line,
     * empty for collapsed selection
     */
    public Array<Rectangle> selectionRects(Selection selection) {
        final Array<Rectangle> result = new Array<>(Rectangle.class);
        final Selection snapped = snapSelection(selection);
        if (snapped.isCollapsed()) {
            return result;
        }
        final int start = snapped.start(), end = snapped.end();

        for (int l = prefixSums.lineAt(start); l < lines.size; l++) {
            final LineBox<F> line = lines.get(l);
            if (line.start >= end) break;

            float left = 0f;
            boolean open = false;
            for (int g = 0, n = line.getGraphemeCount(); g < n; g++) {
                final int graphemeStart = line.getGraphemeStart(g);
                final boolean selected = graphemeStart >= start && graphemeStart < end;
                if (selected && !open) {
                    left = line.getStopX(g);
                    open = true;
                } else if (!selected && open) {
                    result.add(new Rectangle(left, line.yOffset, line.getStopX(g) - left, line.height));
                    open = false;
                }
            }
            if (open) {
                final float right = line.getStopX(line.getStopCount() - 1);
                result.add(new Rectangle(left, line.yOffset, right - left, line.height));
            }
        }
        return result;
    }

    /**
     * @return word or the run of non-word characters (whitespace, punctuation) at the offset,
     * collapsed selection at the end of the text
     */
    public Selection selectWordAt(int offset) {
        offset = snap(offset);
        final WordBoundary segment = WordSegmentation.segmentAt(text, offset);
        if (segment == null) {
            return Selection.collapsed(offset);
        }
        return new Selection(segment.start, segment.end);
    }

    /** @return visual line with the offset, without its hard line break */
    public Selection selectLineAt(int offset) {
        final LineBox<F> line = lines.get(lineIndexAt(snap(offset), Affinity.DOWNSTREAM));
        return new Selection(line.start, line.contentEnd());
    }

    /** @return hard line with the offset, without its line break */
    public Selection selectParagraphAt(int offset) {
        offset = snap(offset);
        return new Selection(CursorMovement.paragraphStart(text, offset), CursorMovement.paragraphEnd(text, offset));
    }

    public Selection selectAll() {
        return new Selection(0, text.length());
    }

    /**
     * @return selection with the same anchor, whose focus was moved by one unit
     */
    public Selection extendSelection(Selection selection, MovementUnit unit, boolean forward) {
        final Selection snapped = snapSelection(selection);
        final int focus = forward ? moveRight(snapped.focus, unit) : moveLeft(snapped.focus, unit);
        return snapped.extendTo(focus);
    }

    //endregion

    //region Editing

    /**
     * Replace text in [from, to) with insert and update the lines.
     * Offsets are expected to be already snapped.
     * @return end of the inserted text
     */
    int replace(int from, int to, CharSequence insert) {
        final String oldText = this.text;
        final int oldLength = oldText.length();
        assert 0 <= from && from <= to && to <= oldLength : "[" + from + ", " + to + ") not in [0, " + oldLength + ")";

        final String newText = new StringBuilder(oldLength - (to - from) + insert.length())
                .append(oldText, 0, from).append(insert).append(oldText, to, oldLength).toString();
        final int delta = newText.length() - oldLength;
        this.text = newText;

        if (cache != null) {
            final Array<LineBox<F>> cached = cache.get(newText, params);
            if (cached != null) {
                setLines(cached);
                return from + insert.length();
            }
        }

        // Affected paragraphs of the old text
        int paragraphStart = LineBreaking.paragraphStart(oldText, from);
        if (paragraphStart > 0 && oldText.charAt(paragraphStart - 1) == '\r') {
            // Inserted LF may join with the CR before it
            paragraphStart = LineBreaking.paragraphStart(oldText, paragraphStart - 1);
        }
        int paragraphEnd = LineBreaking.paragraphEnd(oldText, to);

        // Lines of one bidi paragraph share its level, extend to boundaries of both kinds
        while (paragraphStart > 0 && !BidiResolver.isParagraphSeparator(oldText.charAt(paragraphStart - 1))) {
            paragraphStart = LineBreaking.paragraphStart(oldText, BidiResolver.paragraphStart(oldText, paragraphStart));
        }
        while (paragraphEnd < oldLength && !BidiResolver.isParagraphSeparator(oldText.charAt(paragraphEnd - 1))) {
            final int bidiEnd = BidiResolver.paragraphEnd(oldText, paragraphEnd);
            paragraphEnd = bidiEnd == oldLength || LineBreaking.hardBreakLengthBefore(oldText, bidiEnd) > 0
                    ? bidiEnd : LineBreaking.paragraphEnd(oldText, bidiEnd);
        }

        final Array<LineBox<F>> oldLines = this.lines;
        final int firstReplaced = prefixSums.lineAt(paragraphStart);
        assert oldLines.get(firstReplaced).start == paragraphStart;
        int firstKept = oldLines.size;
        if (paragraphEnd < oldLength) {
            firstKept = prefixSums.lineAt(paragraphEnd);
            assert oldLines.get(firstKept).start == paragraphEnd;
        }

        final Array<LineBox<F>> newLines = new Array<>(true, oldLines.size + 4);
        for (int i = 0; i < firstReplaced; i++) {
            newLines.add(oldLines.get(i));
        }
        final float top = oldLines.get(firstReplaced).yOffset;
        final float bottom = new LineBreaker<>(shaper, params)
                .layoutParagraphs(newText, paragraphStart, paragraphEnd + delta, top, newLines);
        final int relaidCount = newLines.size - firstReplaced;

        if (firstKept < oldLines.size) {
            final float dy = bottom - oldLines.get(firstKept).yOffset;
            for (int i = firstKept; i < oldLines.size; i++) {
                newLines.add(oldLines.get(i).shifted(delta, dy));
            }
        }

        if (LOG.getLevel() >= Logger.DEBUG) {
            LOG.debug("Relayout of [" + paragraphStart + ", " + (paragraphEnd + delta) + "), "
                    + (firstKept - firstReplaced) + " lines replaced by " + relaidCount);
        }
        setLines(newLines);
        return from + insert.length();
    }

    private int edit(int from, int to, CharSequence insert, LayoutParams<F> newParams) {
        if (newParams != null && !newParams.equals(params)) {
            final String oldText = this.text;
            this.params = newParams;
            this.text = new StringBuilder(oldText.length() - (to - from) + insert.length())
                    .append(oldText, 0, from).append(insert).append(oldText, to, oldText.length()).toString();
            layoutFully();
            return from + insert.length();
        }
        if (from == to && insert.length() == 0) {
            return from;
        }
        return replace(from, to, insert);
    }

    /** @return offset after the inserted text */
    public int insertString(int offset, CharSequence string) {
        return insertString(offset, string, null);
    }

    /** @param params new params to lay out with, null to keep the current ones */
    public int insertString(int offset, CharSequence string, LayoutParams<F> params) {
        if (string == null) throw new NullPointerException("string");
        offset = snap(offset);
        return edit(offset, offset, string, params);
    }

    /**
     * @throws IllegalArgumentException if codePoint is not a valid code point
     */
    public int insertChar(int offset, int codePoint) {
        return insertChar(offset, codePoint, null);
    }

    public int insertChar(int offset, int codePoint, LayoutParams<F> params) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point: " + codePoint);
        }
        return insertString(offset, new String(Character.toChars(codePoint)), params);
    }

    public int insertNewline(int offset) {
        return insertString(offset, "\n", null);
    }

    public int insertNewline(int offset, LayoutParams<F> params) {
        return insertString(offset, "\n", params);
    }

    public int insertTab(int offset) {
        return insertString(offset, "\t", null);
    }

    public int insertTab(int offset, LayoutParams<F> params) {
        return insertString(offset, "\t", params);
    }

    /** @return offset after the inserted text */
    public int replaceSelection(Selection selection, CharSequence string) {
        return replaceSelection(selection, string, null);
    }

    public int replaceSelection(Selection selection, CharSequence string, LayoutParams<F> params) {
        if (string == null) throw new NullPointerException("string");
        final Selection snapped = snapSelection(selection);
        return edit(snapped.start(), snapped.end(), string, params);
    }

    /** Delete the grapheme before the offset. @return start of the deleted grapheme */
    public int deleteBackward(int offset) {
        return deleteBackward(offset, null);
    }

    public int deleteBackward(int offset, LayoutParams<F> params) {
        offset = snap(offset);
        final int start = CursorMovement.previousGrapheme(text, offset);
        return deleteRange(start, offset, params);
    }

    /** Delete the grapheme after the offset. @return the offset */
    public int deleteForward(int offset) {
        return deleteForward(offset, null);
    }

    public int deleteForward(int offset, LayoutParams<F> params) {
        offset = snap(offset);
        final int end = CursorMovement.nextGrapheme(text, offset);
        return deleteRange(offset, end, params);
    }

    /** Delete from the start of the previous word to the offset. @return start of the deleted range */
    public int deleteWordBackward(int offset) {
        return deleteWordBackward(offset, null);
    }

    public int deleteWordBackward(int offset, LayoutParams<F> params) {
        offset = snap(offset);
        return deleteRange(CursorMovement.wordLeft(text, offset), offset, params);
    }

    /** Delete from the offset to the end of the next word. @return the offset */
    public int deleteWordForward(int offset) {
        return deleteWordForward(offset, null);
    }

    public int deleteWordForward(int offset, LayoutParams<F> params) {
        offset = snap(offset);
        return deleteRange(offset, CursorMovement.wordRight(text, offset), params);
    }

    /** @return start of the selection, or its focus when it is collapsed */
    public int deleteSelection(Selection selection) {
        return deleteSelection(selection, null);
    }

    public int deleteSelection(Selection selection, LayoutParams<F> params) {
        final Selection snapped = snapSelection(selection);
        if (snapped.isCollapsed()) {
            return snapped.focus;
        }
        return deleteRange(snapped.start(), snapped.end(), params);
    }

    /**
     * Delete the hard line with the offset, including its line break.
     * The last line has no line break, the break before it is kept.
     * @return start of the deleted line
     */
    public int deleteLine(int offset) {
        return deleteLine(offset, null);
    }

    public int deleteLine(int offset, LayoutParams<F> params) {
        offset = snap(offset);
        return deleteRange(LineBreaking.paragraphStart(text, offset), lineDeletionEnd(offset), params);
    }

    /** @return end of the range removed by {@link #deleteLine(int)} */
    int lineDeletionEnd(int offset) {
        return LineBreaking.paragraphEnd(text, offset);
    }

    private int deleteRange(int from, int to, LayoutParams<F> params) {
        edit(from, to, "", params);
        return from;
    }

    //endregion

    @Override
    public String toString() {
        return "TextLayout{" + lines.size + " lines, " + text.length() + " chars, " + params + '}';
    }
}
