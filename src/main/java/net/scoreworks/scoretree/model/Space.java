/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

/**
 * Invisible event that only takes up time
 */
public class Space extends DurationalElement {

    public Space(LayerElementOwner owner) {
        super(owner);
    }
}
