/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Amount of an octave displacement in diatonic steps, as written in the ottava sign
 */
public enum OctaveDisplacement {
    EIGHT(8),
    FIFTEEN(15),
    TWENTY_TWO(22),
    NONE(0);

    private final int size;

    OctaveDisplacement(int size) {
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    /**
     * @return number of octaves this displacement spans
     */
    public int getOctaves() {
        return (size + 2) / 8;
    }
}
