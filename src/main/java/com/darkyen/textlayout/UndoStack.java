package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.TimeUtils;

/** History of {@link TextOperation}s.
 *
 * Operations are recorded in groups, which are undone and redone together. Typing joins the previous group when it
 * continues right where the previous insert ended, backspacing when it deletes right before the previous deletion.
 * Only groups younger than {@link #GROUP_THRESHOLD_MILLIS} are joined. */
public final class UndoStack {

    public static final int DEFAULT_LIMIT = 1000;
    public static final long GROUP_THRESHOLD_MILLIS = 500;

    private final Array<Array<TextOperation>> undo = new Array<>();
    private final Array<Array<TextOperation>> redo = new Array<>();

    private int limit;
    private boolean grouping = true;
    private long groupStartMillis;
    /* When true, the next operation always starts a new group. */
    private boolean groupClosed = true;

    public UndoStack() {
        this(DEFAULT_LIMIT);
    }

    /** @param limit maximum amount of groups that can be undone */
    public UndoStack(int limit) {
        setLimit(limit);
    }

    public void push(TextOperation operation) {
        push(operation, TimeUtils.millis());
    }

    /** @param timeMillis time of the operation, for grouping */
    public void push(TextOperation operation, long timeMillis) {
        if (operation == null) throw new NullPointerException("operation");
        redo.clear();

        if (grouping && !groupClosed && undo.size > 0
                && timeMillis - groupStartMillis < GROUP_THRESHOLD_MILLIS
                && continues(undo.peek().peek(), operation)) {
            undo.peek().add(operation);
            return;
        }

        final Array<TextOperation> group = new Array<>(true, 4, TextOperation.class);
        group.add(operation);
        undo.add(group);
        groupStartMillis = timeMillis;
        groupClosed = false;
        while (undo.size > limit) {
            undo.removeIndex(0);
        }
    }

    private static boolean continues(TextOperation previous, TextOperation next) {
        if (previous.kind == TextOperation.Kind.INSERT && next.kind == TextOperation.Kind.INSERT) {
            return next.offset == previous.insertedEnd();
        }
        if (previous.kind == TextOperation.Kind.DELETE && next.kind == TextOperation.Kind.DELETE) {
            return next.removedEnd() == previous.offset;
        }
        return false;
    }

    /** Make sure that the next operation starts a new group, for example after the cursor was moved. */
    public void closeGroup() {
        groupClosed = true;
    }

    /** @return operations of the undone group, in the order in which they were done, or null if there is nothing to undo */
    public Array<TextOperation> undo() {
        if (undo.size == 0) return null;
        final Array<TextOperation> group = undo.pop();
        redo.add(group);
        groupClosed = true;
        return group;
    }

    /** @return operations of the redone group, in the order in which they were done, or null if there is nothing to redo */
    public Array<TextOperation> redo() {
        if (redo.size == 0) return null;
        final Array<TextOperation> group = redo.pop();
        undo.add(group);
        groupClosed = true;
        return group;
    }

    public boolean canUndo() {
        return undo.size > 0;
    }

    public boolean canRedo() {
        return redo.size > 0;
    }

    public int getUndoCount() {
        return undo.size;
    }

    public int getRedoCount() {
        return redo.size;
    }

    public int getLimit() {
        return limit;
    }

    /** Change the limit, the oldest groups over it are dropped. */
    public void setLimit(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive: " + limit);
        this.limit = limit;
        while (undo.size > limit) {
            undo.removeIndex(0);
        }
    }

    public boolean isGrouping() {
        return grouping;
    }

    /** @param grouping false to make each operation its own group */
    public void setGrouping(boolean grouping) {
        this.grouping = grouping;
    }

    public void clear() {
        undo.clear();
        redo.clear();
        groupClosed = true;
    }
}
