/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.PitchName;

/**
 * Rest filling a whole measure
 */
public class MRest extends LayerElement {
    boolean visible = true;
    boolean cue;
    PitchName ploc = PitchName.NONE;
    Integer oloc;

    public MRest(LayerElementOwner owner) {
        super(owner);
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }

    public PitchName getPloc() {
        return ploc;
    }

    public void setPloc(PitchName ploc) {
        this.ploc = ploc;
    }

    public Integer getOloc() {
        return oloc;
    }

    public void setOloc(Integer oloc) {
        this.oloc = oloc;
    }
}
