/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.NumberedChild;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Staff extends NumberedChild<Measure> {
    final List<Layer> layers = new ArrayList<>();

    public Staff(Measure measure, int n) {
        super(measure, n);
    }

    protected void removeFromOwner() {
        getOwner().staves.remove(this);
    }
    protected void addToOwner() {
        getOwner().staves.add(this);
    }

    public List<Layer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public Layer getLayer(int idx) {
        return layers.get(idx);
    }

    public int getLayerCount() {
        return layers.size();
    }

    /**
     * @return the layer with the given number or null
     */
    public @Nullable Layer findLayer(int n) {
        for (Layer layer : layers) {
            if (layer.getN() == n)
                return layer;
        }
        return null;
    }
}
