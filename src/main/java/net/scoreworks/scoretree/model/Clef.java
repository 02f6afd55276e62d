/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.Place;

/**
 * Clef change within a layer
 */
public class Clef extends LayerElement {
    ClefShape shape = ClefShape.NONE;
    int line;
    OctaveDisplacement dis = OctaveDisplacement.NONE;
    Place disPlace = Place.NONE;

    public Clef(LayerElementOwner owner) {
        super(owner);
    }

    public ClefShape getShape() {
        return shape;
    }

    public void setShape(ClefShape shape) {
        this.shape = shape;
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
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
