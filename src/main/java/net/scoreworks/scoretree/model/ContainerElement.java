/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Layer element grouping other layer elements, like beams or tuplets
 */
public abstract class ContainerElement extends LayerElement implements LayerElementOwner {
    final List<LayerElement> elements = new ArrayList<>();

    protected ContainerElement(LayerElementOwner owner) {
        super(owner);
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
