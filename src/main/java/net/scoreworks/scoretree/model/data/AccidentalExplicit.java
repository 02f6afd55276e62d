/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Accidental that is written out
 */
public enum AccidentalExplicit {
    SHARP("s"),
    NATURAL("n"),
    FLAT("f"),
    DOUBLE_SHARP("x"),
    SHARP_SHARP("ss"),
    FLAT_FLAT("ff"),
    NATURAL_SHARP("ns"),
    NATURAL_FLAT("nf"),
    QUARTER_FLAT("1qf"),
    QUARTER_SHARP("1qs"),
    THREE_QUARTERS_FLAT("3qf"),
    THREE_QUARTERS_SHARP("3qs"),
    NONE("");

    private final String code;

    AccidentalExplicit(String code) {
        this.code = code;
    }

    /**
     * @return the short code of this value, empty for {@link #NONE}
     */
    public String getCode() {
        return code;
    }
}
