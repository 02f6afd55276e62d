/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.NumberedChild;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One voice of a staff. The number of the layer is the voice number it was created for
 */
public class Layer extends NumberedChild<Staff> implements LayerElementOwner {
    final List<LayerElement> elements = new ArrayList<>();

    public Layer(Staff staff, int n) {
        super(staff, n);
    }

    protected void removeFromOwner() {
        getOwner().layers.remove(this);
    }
    protected void addToOwner() {
        getOwner().layers.add(this);
    }

    @Override
    public List<LayerElement> getElements() {
        return Collections.unmodifiableList(elements);
    }
    @Override
    public void addElement(LayerElement element) {
        elements.add(element);
    }
    @Override
    public void removeElement(LayerElement element) {
        elements.remove(element);
    }
}
