/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;

public class Trill extends ControlElement {

    public Trill(RootEntity root) {
        super(root);
    }
}
