/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.StaffRel;
import net.scoreworks.scoretree.model.data.TupletNumberFormat;

public class Tuplet extends ContainerElement {
    int num;
    int numBase;
    StaffRel numPlace = StaffRel.NONE;
    StaffRel bracketPlace = StaffRel.NONE;
    TupletNumberFormat numFormat = TupletNumberFormat.NONE;
    BooleanValue numVisible = BooleanValue.NONE;
    BooleanValue bracketVisible = BooleanValue.NONE;

    public Tuplet(LayerElementOwner owner) {
        super(owner);
    }

    public int getNum() {
        return num;
    }

    public void setNum(int num) {
        this.num = num;
    }

    public int getNumBase() {
        return numBase;
    }

    public void setNumBase(int numBase) {
        this.numBase = numBase;
    }

    public StaffRel getNumPlace() {
        return numPlace;
    }

    public void setNumPlace(StaffRel numPlace) {
        this.numPlace = numPlace;
    }

    public StaffRel getBracketPlace() {
        return bracketPlace;
    }

    public void setBracketPlace(StaffRel bracketPlace) {
        this.bracketPlace = bracketPlace;
    }

    public TupletNumberFormat getNumFormat() {
        return numFormat;
    }

    public void setNumFormat(TupletNumberFormat numFormat) {
        this.numFormat = numFormat;
    }

    public BooleanValue getNumVisible() {
        return numVisible;
    }

    public void setNumVisible(BooleanValue numVisible) {
        this.numVisible = numVisible;
    }

    public BooleanValue getBracketVisible() {
        return bracketVisible;
    }

    public void setBracketVisible(BooleanValue bracketVisible) {
        this.bracketVisible = bracketVisible;
    }
}
