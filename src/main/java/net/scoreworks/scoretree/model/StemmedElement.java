/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.StemDirection;
import net.scoreworks.scoretree.model.data.StemModifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event with a stem, i.e. a note or a chord. Articulations are attached to these
 */
public abstract class StemmedElement extends DurationalElement {
    final List<Artic> artics = new ArrayList<>();
    StemDirection stemDir = StemDirection.NONE;
    StemModifier stemMod = StemModifier.NONE;

    protected StemmedElement(LayerElementOwner owner) {
        super(owner);
    }

    public List<Artic> getArtics() {
        return Collections.unmodifiableList(artics);
    }

    public StemDirection getStemDir() {
        return stemDir;
    }

    public void setStemDir(StemDirection stemDir) {
        this.stemDir = stemDir;
    }

    public StemModifier getStemMod() {
        return stemMod;
    }

    public void setStemMod(StemModifier stemMod) {
        this.stemMod = stemMod;
    }
}
