/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.FermataForm;
import net.scoreworks.scoretree.model.data.FermataShape;

public class Fermata extends ControlElement {
    FermataShape shape = FermataShape.NONE;
    FermataForm form = FermataForm.NONE;

    public Fermata(RootEntity root) {
        super(root);
    }

    public FermataShape getShape() {
        return shape;
    }

    public void setShape(FermataShape shape) {
        this.shape = shape;
    }

    public FermataForm getForm() {
        return form;
    }

    public void setForm(FermataForm form) {
        this.form = form;
    }
}
