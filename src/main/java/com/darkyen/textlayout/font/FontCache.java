package com.darkyen.textlayout.font;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.Logger;
import com.badlogic.gdx.utils.ObjectMap;
import com.darkyen.textlayout.TextLayout;

/** Cache of loaded fonts, keyed by file path and face index.
 *
 * Thread safe, all lookups and loads happen under a single lock.
 * Failed loads are not cached, the exception is propagated to the caller. */
public final class FontCache <F extends Font<F>> {

    private static final Logger LOG = TextLayout.LOG;

    private final FontLoader<F> loader;
    private final ObjectMap<String, F> fonts = new ObjectMap<>();

    public FontCache(FontLoader<F> loader) {
        if (loader == null) throw new NullPointerException("loader");
        this.loader = loader;
    }

    private static String keyOf(FileHandle file, int faceIndex) {
        return file.path() + '#' + faceIndex;
    }

    /** @see #get(FileHandle, int) */
    public F get(FileHandle file) {
        return get(file, 0);
    }

    /** Return the font loaded from given file, loading it if it is not cached yet.
     * @throws GdxRuntimeException when the font fails to load */
    public F get(FileHandle file, int faceIndex) {
        if (file == null) throw new NullPointerException("file");
        final String key = keyOf(file, faceIndex);
        synchronized (fonts) {
            F font = fonts.get(key);
            if (font != null) {
                return font;
            }

            font = loader.load(file, faceIndex);
            if (font == null) {
                throw new GdxRuntimeException("Font loader returned no font for " + key);
            }
            fonts.put(key, font);
            if (LOG.getLevel() >= Logger.INFO) {
                LOG.info("Loaded font " + key);
            }
            return font;
        }
    }

    /** @return true if the font is already loaded */
    public boolean contains(FileHandle file, int faceIndex) {
        synchronized (fonts) {
            return fonts.containsKey(keyOf(file, faceIndex));
        }
    }

    public int size() {
        synchronized (fonts) {
            return fonts.size;
        }
    }

    public void clear() {
        synchronized (fonts) {
            fonts.clear();
        }
    }
}
