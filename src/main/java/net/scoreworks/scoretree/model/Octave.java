/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.Place;

/**
 * Octave shift line. The element ends at {@link #getEndId()}, which is set once the shift stops
 */
public class Octave extends ControlElement {
    OctaveDisplacement dis = OctaveDisplacement.NONE;
    Place disPlace = Place.NONE;

    public Octave(RootEntity root) {
        super(root);
    }

    public OctaveDisplacement getDis() {
        return dis;
    }

    public void setDis(OctaveDisplacement dis) {
        this.dis = dis;
    }

    public Place getDisPlace() {
        return disPlace;
    }

    public void setDisPlace(Place disPlace) {
        this.disPlace = disPlace;
    }
}
