package com.lattice.converter.parser;

import java.util.Locale;

import com.lattice.converter.model.ElementKind;

/**
 * Drops the beam-momentum and optics sections of a SAD file before lexing.
 *
 * A line mentioning {@code MOMENTUM} (any case) starts a skipped section; the
 * section ends at the first line that mentions an element-type keyword, and
 * that line is kept. One instance per parse.
 */
public class SectionSkipFilter {

    static final String SECTION_MARKER = "MOMENTUM";

    private boolean skipping;
    private int droppedLines;

    /**
     * @return {@code true} if the line should be lexed
     */
    public boolean accept(String line) {
        String upper = line.toUpperCase(Locale.ROOT);

        if (upper.contains(SECTION_MARKER)) {
            skipping = true;
            droppedLines++;
            return false;
        }

        if (skipping) {
            if (!mentionsElementKeyword(upper)) {
                droppedLines++;
                return false;
            }
            skipping = false;
        }
        return true;
    }

    public boolean isSkipping() {
        return skipping;
    }

    public int getDroppedLines() {
        return droppedLines;
    }

    private static boolean mentionsElementKeyword(String upperLine) {
        for (String keyword : ElementKind.keywords()) {
            if (upperLine.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
