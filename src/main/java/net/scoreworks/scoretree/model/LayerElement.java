/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.annotations.AbstractClass;

/**
 * Base class of all events of a layer. The set of events is closed, see the subclasses listed below
 */
@AbstractClass(subclasses = {Note.class, Rest.class, MRest.class, Space.class, Chord.class, Beam.class,
        Tuplet.class, Clef.class, MRpt.class, BTrem.class, FTrem.class})
public abstract class LayerElement extends Child<LayerElementOwner> {

    protected LayerElement(LayerElementOwner owner) {
        super(owner);
    }

    protected void removeFromOwner() {
        getOwner().removeElement(this);
    }
    protected void addToOwner() {
        getOwner().addElement(this);
    }

    /**
     * @return the layer this element belongs to, possibly through several containers
     */
    public Layer getLayer() {
        LayerElementOwner it = getOwner();
        while (!(it instanceof Layer)) {
            it = ((LayerElement) it).getOwner();
        }
        return (Layer) it;
    }
}
