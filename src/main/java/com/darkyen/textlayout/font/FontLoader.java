package com.darkyen.textlayout.font;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;

/** Loads fonts of one kind for the {@link FontCache}. */
public interface FontLoader <F extends Font<F>> {

    /** @param file with the font data
     * @param faceIndex index of the face in font collections, 0 for single face files
     * @return loaded font, never null
     * @throws GdxRuntimeException when the file can't be read or is malformed */
    F load(FileHandle file, int faceIndex);
}
