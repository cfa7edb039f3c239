package com.darkyen.textlayout;

import com.badlogic.gdx.Application;
import com.badlogic.gdx.Gdx;
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class LayoutCacheTests {

    private static final LayoutParams<TestFont> PARAMS = new LayoutParams<>(TestFont.REGULAR, 10f);

    @AfterEach
    public void resetLogging() {
        TextLayout.LOG.setLevel(Logger.ERROR);
        Gdx.app = null;
    }

    @Test
    public void layoutsAreSharedTest() {
        final LayoutCache<TestFont> cache = new LayoutCache<>();
        final TestShaper shaper = new TestShaper();
        final TextLayout<TestFont> first = new TextLayout<>(shaper, "shared text", PARAMS, cache);
        final int runs = shaper.shapedRuns;
        final TextLayout<TestFont> second = new TextLayout<>(shaper, new StringBuilder("shared text"), PARAMS, cache);

        assertSame(first.getLines(), second.getLines());
        assertEquals(runs, shaper.shapedRuns);
        assertEquals(1, cache.size());
        assertSame(first.getLines(), cache.get("shared text", PARAMS));

        assertNull(cache.get("shared text", PARAMS.withWrap(50f, WrapMode.BREAK_WORD)));
        new TextLayout<>(shaper, "shared text", PARAMS.withWrap(50f, WrapMode.BREAK_WORD), cache);
        assertEquals(2, cache.size());
    }

    @Test
    public void evictionTest() {
        final LayoutCache<TestFont> cache = new LayoutCache<>(2);
        assertEquals(2, cache.getMaxEntries());
        for (int i = 0; i < 4; i++) {
            cache.getOrLayout("text " + i, PARAMS, TestShaper.INSTANCE);
        }
        assertEquals(4, cache.size());

        final Application application = mock(Application.class);
        Gdx.app = application;
        TextLayout.LOG.setLevel(Logger.DEBUG);
        cache.getOrLayout("text 4", PARAMS, TestShaper.INSTANCE);
        assertEquals(3, cache.size());
        assertNotNull(cache.get("text 4", PARAMS));
        verify(application).debug(eq("TextLayout"), eq("Evicted 2 layouts, 2 remain"));

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    public void invalidSizeTest() {
        assertThrows(IllegalArgumentException.class, () -> new LayoutCache<TestFont>(0));
        assertEquals(LayoutCache.DEFAULT_MAX_ENTRIES, new LayoutCache<TestFont>().getMaxEntries());
    }

    @Test
    public void editBackToCachedTextTest() {
        final LayoutCache<TestFont> cache = new LayoutCache<>();
        final TextLayout<TestFont> layout = new TextLayout<>(TestShaper.INSTANCE, "abc\ndef", PARAMS, cache);
        final Array<LineBox<TestFont>> original = layout.getLines();

        layout.insertString(3, "x");
        assertNotSame(original, layout.getLines());
        assertNull(cache.get("abcx\ndef", PARAMS));

        layout.deleteBackward(4);
        assertEquals("abc\ndef", layout.getText());
        assertSame(original, layout.getLines());
    }

    @Test
    public void concurrentLayoutTest() throws InterruptedException {
        final LayoutCache<TestFont> cache = new LayoutCache<>(16);
        final Thread[] threads = new Thread[4];
        final Throwable[] failure = new Throwable[1];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        final Array<LineBox<TestFont>> lines = cache.getOrLayout("line " + (i % 40), PARAMS, new TestShaper());
                        assertEquals(1, lines.size);
                    }
                } catch (Throwable e) {
                    synchronized (failure) {
                        failure[0] = e;
                    }
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        synchronized (failure) {
            assertNull(failure[0]);
        }
        assertTrue(cache.size() <= 32);
    }
}
