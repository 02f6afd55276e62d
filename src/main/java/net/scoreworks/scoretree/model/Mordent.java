/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.OrnamentForm;

public class Mordent extends ControlElement {
    OrnamentForm form = OrnamentForm.NORM;
    boolean longMordent;

    public Mordent(RootEntity root) {
        super(root);
    }

    public OrnamentForm getForm() {
        return form;
    }

    public void setForm(OrnamentForm form) {
        this.form = form;
    }

    public boolean isLong() {
        return longMordent;
    }

    public void setLong(boolean longMordent) {
        this.longMordent = longMordent;
    }
}
