/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.PitchName;

public class Rest extends DurationalElement {
    PitchName ploc = PitchName.NONE;
    Integer oloc;

    public Rest(LayerElementOwner owner) {
        super(owner);
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
