/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

/**
 * Fingered tremolo between two events
 */
public class FTrem extends ContainerElement {
    int slash;

    public FTrem(LayerElementOwner owner) {
        super(owner);
    }

    public int getSlash() {
        return slash;
    }

    public void setSlash(int slash) {
        this.slash = slash;
    }
}
