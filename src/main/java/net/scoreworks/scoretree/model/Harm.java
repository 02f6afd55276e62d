/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;

/**
 * Harmony symbol, the chord name is the text content
 */
public class Harm extends TextControlElement {
    String type;

    public Harm(RootEntity root) {
        super(root);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
