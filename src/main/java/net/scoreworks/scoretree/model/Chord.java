/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simultaneous notes sharing duration and stem
 */
public class Chord extends StemmedElement implements LayerElementOwner {
    final List<LayerElement> notes = new ArrayList<>();

    public Chord(LayerElementOwner owner) {
        super(owner);
    }

    @Override
    public List<LayerElement> getElements() {
        return Collections.unmodifiableList(notes);
    }
    @Override
    public void addElement(LayerElement element) {
        notes.add(element);
    }
    @Override
    public void removeElement(LayerElement element) {
        notes.remove(element);
    }
}
