/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.PedalDirection;

public class Pedal extends ControlElement {
    PedalDirection dir = PedalDirection.NONE;

    public Pedal(RootEntity root) {
        super(root);
    }

    public PedalDirection getDir() {
        return dir;
    }

    public void setDir(PedalDirection dir) {
        this.dir = dir;
    }
}
