/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

/**
 * Repetition of the previous measure
 */
public class MRpt extends LayerElement {

    public MRpt(LayerElementOwner owner) {
        super(owner);
    }
}
