/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Sounding alteration of a pitch that is not necessarily written, in quarter-tone steps from -2 to +2
 */
public enum AccidentalImplicit {
    DOUBLE_FLAT("ff"),
    THREE_QUARTERS_FLAT("fd"),
    FLAT("f"),
    QUARTER_FLAT("fu"),
    NATURAL("n"),
    QUARTER_SHARP("sd"),
    SHARP("s"),
    THREE_QUARTERS_SHARP("su"),
    DOUBLE_SHARP("ss"),
    NONE("");

    private final String code;

    AccidentalImplicit(String code) {
        this.code = code;
    }

    /**
     * @return the short code of this value, empty for {@link #NONE}
     */
    public String getCode() {
        return code;
    }
}
