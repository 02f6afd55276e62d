/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Written duration of an event. The numeric codes are the denominators of the note values
 */
public enum Duration {
    MAXIMA("maxima"),
    LONG("long"),
    BREVE("breve"),
    WHOLE("1"),
    HALF("2"),
    QUARTER("4"),
    EIGHTH("8"),
    SIXTEENTH("16"),
    THIRTY_SECOND("32"),
    SIXTY_FOURTH("64"),
    HUNDRED_TWENTY_EIGHTH("128"),
    TWO_HUNDRED_FIFTY_SIXTH("256"),
    NONE("");

    private final String code;

    Duration(String code) {
        this.code = code;
    }

    /**
     * @return the short code of this value, empty for {@link #NONE}
     */
    public String getCode() {
        return code;
    }
}
