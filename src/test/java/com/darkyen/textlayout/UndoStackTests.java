package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UndoStackTests {

    private static TextOperation insert(int offset, String text) {
        return new TextOperation(offset, "", text, Selection.collapsed(offset), Selection.collapsed(offset + text.length()));
    }

    private static TextOperation delete(int offset, String oldText) {
        return new TextOperation(offset, oldText, "", Selection.collapsed(offset + oldText.length()), Selection.collapsed(offset));
    }

    @Test
    public void operationKindTest() {
        assertEquals(TextOperation.Kind.INSERT, insert(0, "a").kind);
        assertEquals(TextOperation.Kind.DELETE, delete(0, "a").kind);
        final TextOperation replace = new TextOperation(2, "ab", "xyz", new Selection(2, 4), Selection.collapsed(5));
        assertEquals(TextOperation.Kind.REPLACE, replace.kind);
        assertEquals(5, replace.insertedEnd());
        assertEquals(4, replace.removedEnd());
        assertThrows(NullPointerException.class, () -> new TextOperation(0, null, "", null, null));
    }

    @Test
    public void typingIsGroupedTest() {
        final UndoStack stack = new UndoStack();
        stack.push(insert(0, "a"), 1000);
        stack.push(insert(1, "b"), 1100);
        stack.push(insert(2, "c"), 1200);
        assertEquals(1, stack.getUndoCount());

        // Too late
        stack.push(insert(3, "d"), 1600);
        assertEquals(2, stack.getUndoCount());
        // Not continuing
        stack.push(insert(0, "e"), 1650);
        assertEquals(3, stack.getUndoCount());

        final Array<TextOperation> group = stack.undo();
        assertEquals(1, group.size);
        assertEquals("e", group.first().text);
        stack.undo();
        final Array<TextOperation> typed = stack.undo();
        assertEquals(3, typed.size);
        assertEquals("a", typed.get(0).text);
        assertEquals("c", typed.get(2).text);
        assertNull(stack.undo());
    }

    @Test
    public void backspacesAreGroupedTest() {
        final UndoStack stack = new UndoStack();
        stack.push(delete(4, "e"), 0);
        stack.push(delete(3, "d"), 10);
        stack.push(delete(2, "c"), 20);
        assertEquals(1, stack.getUndoCount());

        stack.push(insert(2, "x"), 30);
        assertEquals(2, stack.getUndoCount());
    }

    @Test
    public void closedGroupIsNotJoinedTest() {
        final UndoStack stack = new UndoStack();
        stack.push(insert(0, "a"), 0);
        stack.closeGroup();
        stack.push(insert(1, "b"), 10);
        assertEquals(2, stack.getUndoCount());

        stack.setGrouping(false);
        assertFalse(stack.isGrouping());
        stack.push(insert(2, "c"), 20);
        stack.push(insert(3, "d"), 30);
        assertEquals(4, stack.getUndoCount());
    }

    @Test
    public void redoTest() {
        final UndoStack stack = new UndoStack();
        assertFalse(stack.canUndo());
        assertNull(stack.redo());

        stack.push(insert(0, "a"), 0);
        stack.closeGroup();
        stack.push(insert(1, "b"), 0);
        assertNotNull(stack.undo());
        assertTrue(stack.canRedo());
        assertEquals(1, stack.getRedoCount());

        final Array<TextOperation> redone = stack.redo();
        assertEquals("b", redone.first().text);
        assertFalse(stack.canRedo());
        assertEquals(2, stack.getUndoCount());

        stack.undo();
        stack.push(insert(1, "c"), 0);
        assertFalse(stack.canRedo(), "New edit clears the redo history");
        // Undo closed the group
        assertEquals(2, stack.getUndoCount());
    }

    @Test
    public void limitTest() {
        final UndoStack stack = new UndoStack(3);
        stack.setGrouping(false);
        for (int i = 0; i < 5; i++) {
            stack.push(insert(i, Integer.toString(i)), i);
        }
        assertEquals(3, stack.getUndoCount());
        stack.setLimit(1);
        assertEquals(1, stack.getLimit());
        assertEquals("4", stack.undo().first().text);
        assertFalse(stack.canUndo());

        assertThrows(IllegalArgumentException.class, () -> stack.setLimit(0));
        assertThrows(IllegalArgumentException.class, () -> new UndoStack(-1));

        stack.push(insert(0, "x"), 0);
        stack.clear();
        assertFalse(stack.canUndo());
        assertFalse(stack.canRedo());
    }
}
