/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.ScoreObject;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Owner of {@link LayerElement}s: a {@link Layer} or a container element like a beam, tuplet or chord.
 * The element list is maintained by the elements themselves when they are attached or removed,
 * {@link #addElement(LayerElement)} and {@link #removeElement(LayerElement)} are not meant to be called from anywhere else
 */
public interface LayerElementOwner extends ScoreObject {

    List<LayerElement> getElements();

    void addElement(LayerElement element);

    void removeElement(LayerElement element);

    /**
     * @return the first direct element of the given type or null
     */
    default <T extends LayerElement> @Nullable T getFirst(Class<T> clazz) {
        for (LayerElement element : getElements()) {
            if (clazz.isInstance(element))
                return clazz.cast(element);
        }
        return null;
    }
}
