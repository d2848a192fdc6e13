package com.lattice.converter.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Element-type keywords recognized in SAD source.
 * UNRECOGNIZED marks an element opened without an active keyword.
 */
public enum ElementKind {
    QUAD,
    MARK,
    CAVI,
    BEAMBEAM,
    APERT,
    SOL,
    DRIFT,
    BEND,
    SEXT,
    OCT,
    MULT,
    MONI,
    LINE,
    MAP,
    COORD,
    UNRECOGNIZED;

    private static final Map<String, ElementKind> BY_KEYWORD = Arrays.stream(values())
            .filter(kind -> kind != UNRECOGNIZED)
            .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    /**
     * Keyword spellings as they appear in SAD source (case-sensitive).
     */
    public static Set<String> keywords() {
        return BY_KEYWORD.keySet();
    }

    public static boolean isKeyword(String text) {
        return text != null && BY_KEYWORD.containsKey(text);
    }

    public static ElementKind fromKeyword(String text) {
        if (text == null) {
            return UNRECOGNIZED;
        }
        return BY_KEYWORD.getOrDefault(text, UNRECOGNIZED);
    }
}
