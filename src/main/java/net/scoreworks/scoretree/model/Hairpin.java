/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.HairpinForm;

/**
 * Crescendo or diminuendo wedge
 */
public class Hairpin extends ControlElement {
    HairpinForm form = HairpinForm.NONE;

    public Hairpin(RootEntity root) {
        super(root);
    }

    public HairpinForm getForm() {
        return form;
    }

    public void setForm(HairpinForm form) {
        this.form = form;
    }
}
