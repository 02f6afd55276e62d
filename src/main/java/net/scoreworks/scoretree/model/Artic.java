/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.model.data.Articulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Articulations of a note or chord, in the order they were written
 */
public class Artic extends Child<StemmedElement> {
    final List<Articulation> artic = new ArrayList<>();
    String type;

    public Artic(StemmedElement owner) {
        super(owner);
    }

    protected void removeFromOwner() {
        getOwner().artics.remove(this);
    }
    protected void addToOwner() {
        getOwner().artics.add(this);
    }

    public List<Articulation> getArtic() {
        return Collections.unmodifiableList(artic);
    }

    public void addArtic(Articulation articulation) {
        artic.add(articulation);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
