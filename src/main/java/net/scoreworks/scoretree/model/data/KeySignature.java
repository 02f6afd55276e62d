/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Immutable key signature, either a number of sharps or flats or a mixed (non-traditional) signature
 */
public final class KeySignature {

    public static final KeySignature MIXED = new KeySignature(0, true);

    private final int fifths;
    private final boolean mixed;

    private KeySignature(int fifths, boolean mixed) {
        this.fifths = fifths;
        this.mixed = mixed;
    }

    /**
     * @param fifths position on the circle of fifths, positive for sharps and negative for flats
     */
    public static KeySignature ofFifths(int fifths) {
        return new KeySignature(fifths, false);
    }

    public int getFifths() {
        return fifths;
    }

    public boolean isMixed() {
        return mixed;
    }

    public int getSharps() {
        return Math.max(fifths, 0);
    }

    public int getFlats() {
        return Math.max(-fifths, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof KeySignature)) {
            return false;
        }
        KeySignature other = (KeySignature) o;
        return fifths == other.fifths && mixed == other.mixed;
    }

    @Override
    public int hashCode() {
        return mixed ? -100 : fifths;
    }

    /**
     * @return the signature as {@code 3s}, {@code 2f}, {@code 0} or {@code mixed}
     */
    @Override
    public String toString() {
        if (mixed)
            return "mixed";
        if (fifths > 0)
            return fifths + "s";
        if (fifths < 0)
            return -fifths + "f";
        return "0";
    }
}
