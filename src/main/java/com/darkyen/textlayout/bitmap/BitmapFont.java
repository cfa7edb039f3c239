package com.darkyen.textlayout.bitmap;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.IntFloatMap;
import com.badlogic.gdx.utils.IntMap;
import com.badlogic.gdx.utils.StreamUtils;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.FontLoader;
import com.darkyen.textlayout.font.FontMetrics;

import java.io.BufferedReader;
import java.util.StringTokenizer;

import static java.lang.Integer.parseInt;

/** Simple 1:1 char-glyph font loaded from
 * <a href="http://www.angelcode.com/products/bmfont/doc/file_format.html">textual .fnt file</a>.
 *
 * Only metrics, advances and kernings are loaded, page images are left to the renderer.
 * All values are in font pixels, as written in the file. */
public class BitmapFont implements Font<BitmapFont> {

    /** Loads fonts without fallback, face index is ignored. */
    public static final FontLoader<BitmapFont> LOADER = new FontLoader<BitmapFont>() {
        @Override
        public BitmapFont load(FileHandle file, int faceIndex) {
            return BitmapFont.load(file, null);
        }
    };

    private final String name;
    private final BitmapFont fallback;

    private boolean loaded = false;

    /** The distance from one line of text to the next. */
    public float lineHeight;
    /** Distance from top of the line to baseline. */
    public float base;
    /** Size of the font the file was generated for, used as the em size. */
    public float size;
    /** The x-advance of the space character. Used for all unknown whitespace characters. */
    public float spaceXAdvance;

    private FontMetrics metrics;

    private static final int BMP_GLYPH_COUNT = 0x10000;
    private static final int BMP_GLYPH_PAGE_LOG_2 = 9;
    static private final int BMP_GLYPH_PAGE_SIZE = 1 << BMP_GLYPH_PAGE_LOG_2;
    static private final int BMP_GLYPH_PAGE_COUNT = BMP_GLYPH_COUNT / BMP_GLYPH_PAGE_SIZE;
    /** Glyphs from Basic Multilingual Plane, stored by lazily loaded pages. */
    private final BitmapGlyph[][] glyphsBmp = new BitmapGlyph[BMP_GLYPH_PAGE_COUNT][];
    /** Glyphs that do not fit BMP, stored by glyphId. Lazily instantiated field. */
    private IntMap<BitmapGlyph> glyphsNonBmp = null;

    /** @param name of the font, for debug
     * @param fallback font, or null */
    public BitmapFont(String name, BitmapFont fallback) {
        this.name = name;
        this.fallback = fallback;
    }

    /** Create and load a font.
     * @param fnt .fnt file describing the font
     * @param fallback font, to use when glyphs are missing, or null */
    public static BitmapFont load(FileHandle fnt, BitmapFont fallback) {
        final BitmapFont font = new BitmapFont(fnt.nameWithoutExtension(), fallback);
        font.loadGlyphs(fnt);
        return font;
    }

    public String getName() {
        return name;
    }

    private void addKerning(int firstGlyph, int secondGlyph, float amount) {
        if (amount == 0) {
            // Retrieval assumes, that 0-amount kernings are not stored
            return;
        }
        final BitmapGlyph leftGlyph = getGlyph(firstGlyph);
        final BitmapGlyph rightGlyph = getGlyph(secondGlyph);
        if (leftGlyph == null || rightGlyph == null) {
            // Do not store kernings for glyphs not in the font
            return;
        }

        IntFloatMap kerning = leftGlyph.kerning;
        if (kerning == null) {
            kerning = leftGlyph.kerning = new IntFloatMap();
        }
        kerning.put(secondGlyph, amount);
    }

    /** @return kerning adjustment between the two glyphs, in font pixels */
    public float getKerning(BitmapGlyph firstGlyph, BitmapGlyph secondGlyph) {
        final IntFloatMap kerning = firstGlyph.kerning;
        if (kerning == null) {
            return 0;
        }
        return kerning.get(secondGlyph.glyphId, 0f);
    }

    /** Load glyphs for this font.
     * Must be called (only) once per font.
     *
     * @param fontFile containing text data of the font
     * @throws GdxRuntimeException if the file is missing or malformed */
    public void loadGlyphs(FileHandle fontFile) {
        if (loaded) {
            throw new GdxRuntimeException("Glyphs already loaded");
        }

        BufferedReader reader = null;
        try {
            reader = fontFile.reader(1024, "UTF-8");
            String line = reader.readLine(); // info
            if (line == null) throw new GdxRuntimeException("File is empty");
            if (!line.startsWith("info ")) throw new GdxRuntimeException("Missing info header");
            final float infoSize = parseInfoSize(line);

            line = reader.readLine();
            if (line == null) throw new GdxRuntimeException("Missing common header");
            String[] common = line.split(" ", 7);

            // At least lineHeight and base are required.
            if (common.length < 3) throw new GdxRuntimeException("Invalid common header");

            if (!common[1].startsWith("lineHeight=")) throw new GdxRuntimeException("Missing: lineHeight");
            lineHeight = parseInt(common[1].substring(11));

            if (!common[2].startsWith("base=")) throw new GdxRuntimeException("Missing: base");
            base = parseInt(common[2].substring(5));

            size = infoSize > 0 ? infoSize : lineHeight;
            if (!(size > 0)) throw new GdxRuntimeException("Font has no size");

            final BitmapGlyph[][] glyphsBmp = this.glyphsBmp;
            IntMap<BitmapGlyph> glyphsNonBmp = this.glyphsNonBmp;

            float fallbackXAdvance = -1f;
            while (true) {
                line = reader.readLine();
                if (line == null) break; // EOF
                if (line.startsWith("kernings ")) break; // Starting kernings block.
                if (!line.startsWith("char ")) {
                    // page, chars count and other lines carry nothing needed for layout
                    continue;
                }

                StringTokenizer tokens = new StringTokenizer(line, " =");
                tokens.nextToken();
                tokens.nextToken();
                final int glyphId = parseInt(tokens.nextToken());
                if (glyphId < Character.MIN_CODE_POINT || glyphId > Character.MAX_CODE_POINT) continue;
                tokens.nextToken();
                tokens.nextToken(); // x
                tokens.nextToken();
                tokens.nextToken(); // y
                tokens.nextToken();
                final float width = parseInt(tokens.nextToken());
                tokens.nextToken();
                final float height = parseInt(tokens.nextToken());
                tokens.nextToken();
                final float xOffset = parseInt(tokens.nextToken());
                tokens.nextToken();
                final float yOffset = parseInt(tokens.nextToken());
                tokens.nextToken();
                final float xAdvance = parseInt(tokens.nextToken());

                if (fallbackXAdvance < 0f && xAdvance > 0f) {
                    fallbackXAdvance = xAdvance;
                }

                // .fnt counts yOffset from top of the line to the top edge of rectangle,
                // but we count it from baseline to the bottom edge of rectangle
                final BitmapGlyph glyph = new BitmapGlyph(glyphId, xOffset, base - yOffset - height, width, height, xAdvance);

                if (glyphId < BMP_GLYPH_COUNT) {
                    // BMP Glyph, store in lookup table
                    final int pageIndex = glyphId / BMP_GLYPH_PAGE_SIZE;
                    BitmapGlyph[] pageBmp = glyphsBmp[pageIndex];
                    if (pageBmp == null) {
                        glyphsBmp[pageIndex] = pageBmp = new BitmapGlyph[BMP_GLYPH_PAGE_SIZE];
                    }
                    final int inPageIndex = glyphId & (BMP_GLYPH_PAGE_SIZE - 1);
                    pageBmp[inPageIndex] = glyph;
                } else {
                    // Non BMP Glyph, store in hash map
                    if (glyphsNonBmp == null) {
                        glyphsNonBmp = this.glyphsNonBmp = new IntMap<>();
                    }
                    glyphsNonBmp.put(glyphId, glyph);
                }
            }

            while (true) {
                line = reader.readLine();
                if (line == null) break;
                if (!line.startsWith("kerning ")) break;

                StringTokenizer tokens = new StringTokenizer(line, " =");
                tokens.nextToken();
                tokens.nextToken();
                int first = parseInt(tokens.nextToken());
                tokens.nextToken();
                int second = parseInt(tokens.nextToken());
                if (first < Character.MIN_CODE_POINT || first > Character.MAX_CODE_POINT
                        || second < Character.MIN_CODE_POINT || second > Character.MAX_CODE_POINT) continue;
                tokens.nextToken();
                addKerning(first, second, parseInt(tokens.nextToken()));
            }

            BitmapGlyph spaceGlyph = getGlyph(' ');
            if (spaceGlyph != null) {
                spaceXAdvance = spaceGlyph.xAdvance;
            } else if (fallbackXAdvance != -1) {
                spaceXAdvance = fallbackXAdvance;
            } else {
                spaceXAdvance = lineHeight * 4 / 3;
            }

            final BitmapGlyph capitalX = getGlyph('X');
            final BitmapGlyph smallX = getGlyph('x');
            metrics = new FontMetrics(base, lineHeight - base, 0f, size,
                    capitalX != null ? capitalX.height : base,
                    smallX != null ? smallX.height : base / 2f);

            loaded = true;
        } catch (Exception ex) {
            throw new GdxRuntimeException("Error loading font file: " + fontFile, ex);
        } finally {
            StreamUtils.closeQuietly(reader);
        }
    }

    /** @return absolute value of size= attribute of the info line, or -1 if it is missing */
    private static float parseInfoSize(String infoLine) {
        final StringTokenizer tokens = new StringTokenizer(infoLine, " ");
        while (tokens.hasMoreTokens()) {
            final String token = tokens.nextToken();
            if (token.startsWith("size=")) {
                return Math.abs(parseInt(token.substring(5)));
            }
        }
        return -1f;
    }

    @Override
    public FontMetrics getMetrics() {
        if (!loaded) {
            throw new GdxRuntimeException("Font not loaded");
        }
        return metrics;
    }

    @Override
    public boolean hasGlyph(int codePoint) {
        return getGlyph(codePoint) != null;
    }

    /** @return glyph for the code point, glyph {@link #MISSING_GLYPH_ID} represents the missing glyph */
    public BitmapGlyph getGlyph(int glyphId) {
        if (glyphId >= 0 && glyphId < BMP_GLYPH_COUNT) {
            // Look for it in BMP table
            final int pageIndex = glyphId / BMP_GLYPH_PAGE_SIZE;
            BitmapGlyph[] pageBmp = glyphsBmp[pageIndex];
            if (pageBmp == null) {
                return null;
            }
            final int inPageIndex = glyphId & (BMP_GLYPH_PAGE_SIZE - 1);
            return pageBmp[inPageIndex];
        }

        // Not in BMP table, check hash map for other planes
        final IntMap<BitmapGlyph> glyphsNonBmp = this.glyphsNonBmp;
        if (glyphsNonBmp == null) {
            return null;
        }
        return glyphsNonBmp.get(glyphId);
    }

    @Override
    public BitmapFont getFallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return name;
    }

    /** Single glyph of the font. Glyph ID is the code point it represents.
     * <br>
     * <strong>DO NOT MODIFY THE FIELDS</strong>, they are not final only to allow easier loading. */
    public static final class BitmapGlyph {

        public final int glyphId;
        /** Offsets from the pen point to the bottom left corner of the glyph rectangle.
         * Positive goes to the right and up from the pen point. */
        public float xOffset, yOffset;
        /** Size of the glyph rectangle. */
        public float width, height;
        /** How much should the pen advance after drawing this glyph. */
        public float xAdvance;

        /** Lazily instantiated map of kernings, keyed by the glyph that follows this one. */
        IntFloatMap kerning;

        BitmapGlyph(int glyphId, float xOffset, float yOffset, float width, float height, float xAdvance) {
            this.glyphId = glyphId;
            this.xOffset = xOffset;
            this.yOffset = yOffset;
            this.width = width;
            this.height = height;
            this.xAdvance = xAdvance;
        }

        @Override
        public String toString() {
            if (glyphId > ' ' && glyphId <= Character.MAX_VALUE) {
                return glyphId+" ('"+(char)glyphId+"')";
            } else {
                return Integer.toString(glyphId);
            }
        }
    }
}
