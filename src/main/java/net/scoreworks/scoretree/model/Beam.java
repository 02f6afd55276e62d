/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

/**
 * Beam grouping of notes, chords and rests
 */
public class Beam extends ContainerElement {

    public Beam(LayerElementOwner owner) {
        super(owner);
    }
}
