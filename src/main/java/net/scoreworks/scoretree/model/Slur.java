/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.CurveDirection;

public class Slur extends ControlElement {
    CurveDirection curveDir = CurveDirection.NONE;

    public Slur(RootEntity root) {
        super(root);
    }

    public CurveDirection getCurveDir() {
        return curveDir;
    }

    public void setCurveDir(CurveDirection curveDir) {
        this.curveDir = curveDir;
    }
}
