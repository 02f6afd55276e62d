/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;

/**
 * Dynamic marking like "p" or "sfz"
 */
public class Dynam extends TextControlElement {

    public Dynam(RootEntity root) {
        super(root);
    }
}
