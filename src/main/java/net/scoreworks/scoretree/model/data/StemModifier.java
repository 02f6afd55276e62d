/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Slashes through the stem, used for tremolos and slashed grace notes
 */
public enum StemModifier {
    NONE(0),
    SLASH_1(1),
    SLASH_2(2),
    SLASH_3(3),
    SLASH_4(4),
    SLASH_5(5),
    SLASH_6(6);

    private final int slashes;

    StemModifier(int slashes) {
        this.slashes = slashes;
    }

    public int getSlashes() {
        return slashes;
    }
}
