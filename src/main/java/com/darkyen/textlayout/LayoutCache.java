package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.Logger;
import com.badlogic.gdx.utils.ObjectMap;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.Shaper;

/**
 * Shared cache of complete layouts, keyed by text and {@link LayoutParams}.
 *
 * Thread safe. Cached line arrays are shared between all layouts which use them and must not be modified.
 * The cache should be used only with a single {@link Shaper}, the shaper is not a part of the key.
 *
 * When the cache grows to twice its size, it is trimmed back to {@link #getMaxEntries()} entries, in no particular order.
 */
public final class LayoutCache <F extends Font<F>> {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private static final Logger LOG = TextLayout.LOG;

    private final int maxEntries;
    private final ObjectMap<Key, Array<LineBox<F>>> entries = new ObjectMap<>();

    public LayoutCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public LayoutCache(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        this.maxEntries = maxEntries;
    }

    private static final class Key {
        final String text;
        final LayoutParams<?> params;

        Key(String text, LayoutParams<?> params) {
            this.text = text;
            this.params = params;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final Key key = (Key) o;
            return text.equals(key.text) && params.equals(key.params);
        }

        @Override
        public int hashCode() {
            return 31 * text.hashCode() + params.hashCode();
        }
    }

    /**
     * @return cached lines of the text, or lines which were just laid out and added to the cache
     */
    public Array<LineBox<F>> getOrLayout(String text, LayoutParams<F> params, Shaper<F> shaper) {
        if (text == null) throw new NullPointerException("text");
        if (params == null) throw new NullPointerException("params");
        final Key key = new Key(text, params);
        synchronized (entries) {
            final Array<LineBox<F>> cached = entries.get(key);
            if (cached != null) {
                return cached;
            }
        }

        final Array<LineBox<F>> lines = new LineBreaker<>(shaper, params).layout(text);

        synchronized (entries) {
            final Array<LineBox<F>> raced = entries.get(key);
            if (raced != null) {
                return raced;
            }
            if (entries.size >= maxEntries * 2) {
                evict();
            }
            entries.put(key, lines);
        }
        return lines;
    }

    /** @return cached lines, or null */
    public Array<LineBox<F>> get(String text, LayoutParams<F> params) {
        synchronized (entries) {
            return entries.get(new Key(text, params));
        }
    }

    private void evict() {
        final Array<Key> keys = entries.keys().toArray();
        final int toRemove = entries.size - maxEntries;
        for (int i = 0; i < toRemove; i++) {
            entries.remove(keys.get(i));
        }
        if (LOG.getLevel() >= Logger.DEBUG) {
            LOG.debug("Evicted " + toRemove + " layouts, " + entries.size + " remain");
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size;
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
