/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

/**
 * Bowed tremolo, a single event with slashes through its stem
 */
public class BTrem extends ContainerElement {

    public BTrem(LayerElementOwner owner) {
        super(owner);
    }
}
