package com.darkyen.textlayout.font;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.darkyen.textlayout.TestFont;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

public class FontCacheTests {

    @SuppressWarnings("unchecked")
    private static FontLoader<TestFont> mockLoader() {
        return mock(FontLoader.class);
    }

    @Test
    public void loadsOncePerFaceTest() {
        final FontLoader<TestFont> loader = mockLoader();
        when(loader.load(any(FileHandle.class), anyInt())).thenAnswer(invocation ->
                new TestFont(invocation.<FileHandle>getArgument(0).name() + "#" + invocation.<Integer>getArgument(1)));

        final FontCache<TestFont> cache = new FontCache<>(loader);
        final FileHandle file = new FileHandle("fonts/regular.fnt");

        final TestFont first = cache.get(file);
        assertSame(first, cache.get(file));
        assertSame(first, cache.get(new FileHandle("fonts/regular.fnt"), 0));
        assertEquals("regular.fnt#0", first.name);

        final TestFont secondFace = cache.get(file, 1);
        assertNotSame(first, secondFace);
        assertTrue(cache.contains(file, 1));
        assertEquals(2, cache.size());

        verify(loader, times(1)).load(any(FileHandle.class), eq(0));
        verify(loader, times(1)).load(any(FileHandle.class), eq(1));

        cache.clear();
        assertEquals(0, cache.size());
        assertFalse(cache.contains(file, 0));
    }

    @Test
    public void failedLoadIsNotCachedTest() {
        final FontLoader<TestFont> loader = mockLoader();
        when(loader.load(any(FileHandle.class), anyInt()))
                .thenThrow(new GdxRuntimeException("Error loading font file: broken.fnt"))
                .thenReturn(TestFont.REGULAR);

        final FontCache<TestFont> cache = new FontCache<>(loader);
        final FileHandle file = new FileHandle("broken.fnt");
        assertThrows(GdxRuntimeException.class, () -> cache.get(file));
        assertEquals(0, cache.size());
        assertSame(TestFont.REGULAR, cache.get(file));
    }

    @Test
    public void nullFontIsAnErrorTest() {
        final FontLoader<TestFont> loader = mockLoader();
        final FontCache<TestFont> cache = new FontCache<>(loader);
        assertThrows(GdxRuntimeException.class, () -> cache.get(new FileHandle("missing.fnt")));
        assertEquals(0, cache.size());
    }
}
