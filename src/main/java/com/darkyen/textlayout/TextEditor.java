package com.darkyen.textlayout;

import com.badlogic.gdx.math.Rectangle;
import com.badlogic.gdx.utils.Array;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.unicode.LineBreaking;

/**
 * Editing state of a single text field: the layout, selection, cursor and history.
 *
 * Translates user actions (key presses, clicks, drags) into {@link TextLayout} operations.
 * Every edit is recorded in the {@link UndoStack} and makes the cursor visible.
 */
public final class TextEditor <F extends Font<F>> {

    private final TextLayout<F> layout;
    private final Cursor cursor = new Cursor();
    private final UndoStack undoStack;

    private Selection selection = Selection.collapsed(0);
    /** X to keep between vertical moves, NaN when it should be taken from the cursor. */
    private float preferredX = Float.NaN;
    private float caretWidth = 1f;

    public TextEditor(TextLayout<F> layout) {
        this(layout, new UndoStack());
    }

    public TextEditor(TextLayout<F> layout, UndoStack undoStack) {
        if (layout == null) throw new NullPointerException("layout");
        if (undoStack == null) throw new NullPointerException("undoStack");
        this.layout = layout;
        this.undoStack = undoStack;
    }

    public TextLayout<F> getLayout() {
        return layout;
    }

    public Cursor getCursor() {
        return cursor;
    }

    public UndoStack getUndoStack() {
        return undoStack;
    }

    public Selection getSelection() {
        return selection;
    }

    public String getText() {
        return layout.getText();
    }

    public String getSelectedText() {
        return selection.text(layout.getText());
    }

    public float getCaretWidth() {
        return caretWidth;
    }

    public void setCaretWidth(float caretWidth) {
        this.caretWidth = caretWidth;
    }

    /** Select the range, the ends are snapped. */
    public void setSelection(Selection selection) {
        setSelection(layout.snapSelection(selection), Affinity.DOWNSTREAM);
        undoStack.closeGroup();
    }

    private void setSelection(Selection selection, Affinity affinity) {
        this.selection = selection;
        cursor.setPosition(selection.focus, affinity);
        cursor.resetBlink();
    }

    private void moveFocus(int focus, boolean extend, Affinity affinity) {
        setSelection(extend ? selection.extendTo(focus) : Selection.collapsed(focus), affinity);
        undoStack.closeGroup();
    }

    //region Movement

    /**
     * Move the cursor left. Without extend, non-empty selection collapses to its start instead.
     */
    public void moveLeft(MovementUnit unit, boolean extend) {
        preferredX = Float.NaN;
        if (!extend && !selection.isCollapsed() && unit == MovementUnit.CHARACTER) {
            moveFocus(selection.start(), false, Affinity.DOWNSTREAM);
            return;
        }
        moveFocus(layout.moveLeft(selection.focus, unit), extend, Affinity.DOWNSTREAM);
    }

    /**
     * Move the cursor right. Without extend, non-empty selection collapses to its end instead.
     */
    public void moveRight(MovementUnit unit, boolean extend) {
        preferredX = Float.NaN;
        if (!extend && !selection.isCollapsed() && unit == MovementUnit.CHARACTER) {
            moveFocus(selection.end(), false, Affinity.DOWNSTREAM);
            return;
        }
        final int lineIndex = layout.lineIndexAt(selection.focus, Affinity.DOWNSTREAM);
        final int focus = layout.moveRight(selection.focus, unit);
        final Affinity affinity = unit == MovementUnit.LINE ? layout.affinityOnLine(lineIndex, focus) : Affinity.DOWNSTREAM;
        moveFocus(focus, extend, affinity);
    }

    public void moveUp(boolean extend) {
        final VerticalMove move = layout.moveCursorUp(selection.focus, cursor.getAffinity(), preferredX);
        verticalMove(move, layout.lineIndexAt(selection.focus, cursor.getAffinity()) - 1, extend);
    }

    public void moveDown(boolean extend) {
        final VerticalMove move = layout.moveCursorDown(selection.focus, cursor.getAffinity(), preferredX);
        verticalMove(move, layout.lineIndexAt(selection.focus, cursor.getAffinity()) + 1, extend);
    }

    private void verticalMove(VerticalMove move, int targetLine, boolean extend) {
        final Affinity affinity = targetLine >= 0 && targetLine < layout.getLineCount()
                ? layout.affinityOnLine(targetLine, move.offset) : Affinity.DOWNSTREAM;
        moveFocus(move.offset, extend, affinity);
        preferredX = move.preferredX;
    }

    public void selectAll() {
        preferredX = Float.NaN;
        setSelection(layout.selectAll(), Affinity.DOWNSTREAM);
        undoStack.closeGroup();
    }

    //endregion

    //region Pointer

    /**
     * Handle a click at a point of the layout.
     * @param clickCount 1 places the cursor, 2 selects a word, 3 or more selects a line
     * @param extend true to move only the focus (shift-click)
     */
    public void click(float x, float y, int clickCount, boolean extend) {
        preferredX = Float.NaN;
        final HitTestResult hit = layout.hitTest(x, y, HitTestPolicy.CLAMP);
        if (clickCount <= 1) {
            moveFocus(hit.offset, extend, hit.affinity);
        } else if (clickCount == 2) {
            setSelection(layout.selectWordAt(hit.offset), Affinity.DOWNSTREAM);
            undoStack.closeGroup();
        } else {
            setSelection(layout.selectLineAt(hit.offset), Affinity.DOWNSTREAM);
            undoStack.closeGroup();
        }
    }

    /** Move the focus to the point, keeping the anchor where it is. */
    public void drag(float x, float y) {
        preferredX = Float.NaN;
        final HitTestResult hit = layout.hitTest(x, y, HitTestPolicy.CLAMP);
        moveFocus(hit.offset, true, hit.affinity);
    }

    //endregion

    //region Editing

    private void apply(int from, int to, String insert) {
        final String oldText = layout.getText().substring(from, to);
        final Selection before = selection;
        final int end = layout.replace(from, to, insert);
        final Selection after = Selection.collapsed(end);
        undoStack.push(new TextOperation(from, oldText, insert, before, after));
        preferredX = Float.NaN;
        setSelection(after, Affinity.DOWNSTREAM);
    }

    /** Replace the selection with the text. */
    public void insert(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        final Selection snapped = layout.snapSelection(selection);
        if (snapped.isCollapsed() && text.length() == 0) return;
        apply(snapped.start(), snapped.end(), text.toString());
    }

    public void insertNewline() {
        insert("\n");
    }

    public void insertTab() {
        insert("\t");
    }

    /** @return false if there was nothing to delete */
    private boolean deleteSelection() {
        final Selection snapped = layout.snapSelection(selection);
        if (snapped.isCollapsed()) return false;
        apply(snapped.start(), snapped.end(), "");
        return true;
    }

    /** Delete the selection, or the grapheme before the cursor. */
    public void backspace() {
        if (deleteSelection()) return;
        final int focus = layout.snap(selection.focus);
        final int start = CursorMovement.previousGrapheme(layout.getText(), focus);
        if (start < focus) apply(start, focus, "");
    }

    /** Delete the selection, or the grapheme after the cursor. */
    public void delete() {
        if (deleteSelection()) return;
        final int focus = layout.snap(selection.focus);
        final int end = CursorMovement.nextGrapheme(layout.getText(), focus);
        if (end > focus) apply(focus, end, "");
    }

    public void deleteWordBackward() {
        if (deleteSelection()) return;
        final int focus = layout.snap(selection.focus);
        final int start = CursorMovement.wordLeft(layout.getText(), focus);
        if (start < focus) apply(start, focus, "");
    }

    public void deleteWordForward() {
        if (deleteSelection()) return;
        final int focus = layout.snap(selection.focus);
        final int end = CursorMovement.wordRight(layout.getText(), focus);
        if (end > focus) apply(focus, end, "");
    }

    /** Delete the hard line with the cursor, see {@link TextLayout#deleteLine(int)}. */
    public void deleteLine() {
        final int focus = layout.snap(selection.focus);
        final int start = LineBreaking.paragraphStart(layout.getText(), focus);
        final int end = layout.lineDeletionEnd(focus);
        if (end > start) apply(start, end, "");
    }

    /** @return true if something was undone */
    public boolean undo() {
        final Array<TextOperation> group = undoStack.undo();
        if (group == null) return false;
        for (int i = group.size - 1; i >= 0; i--) {
            final TextOperation operation = group.get(i);
            layout.replace(operation.offset, operation.insertedEnd(), operation.oldText);
        }
        preferredX = Float.NaN;
        setSelection(group.first().selectionBefore, Affinity.DOWNSTREAM);
        return true;
    }

    /** @return true if something was redone */
    public boolean redo() {
        final Array<TextOperation> group = undoStack.redo();
        if (group == null) return false;
        for (TextOperation operation : group) {
            layout.replace(operation.offset, operation.removedEnd(), operation.text);
        }
        preferredX = Float.NaN;
        setSelection(group.peek().selectionAfter, Affinity.DOWNSTREAM);
        return true;
    }

    //endregion

    /** @return rectangle of the caret at the focus of the selection */
    public Rectangle getCursorRect() {
        return layout.cursorRect(cursor.getPosition(), caretWidth);
    }

    public Array<Rectangle> getSelectionRects() {
        return layout.selectionRects(selection);
    }

    /** Advance the cursor blinking. */
    public void update(float delta) {
        cursor.update(delta);
    }
}
