/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.model.data.AccidentalExplicit;
import net.scoreworks.scoretree.model.data.AccidentalFunction;
import net.scoreworks.scoretree.model.data.AccidentalImplicit;
import net.scoreworks.scoretree.model.data.Enclosure;

/**
 * Accidental of a note. A written accidental sets {@link #getAccid()}, a merely sounding alteration sets
 * {@link #getAccidGes()}
 */
public class Accid extends Child<Note> {
    AccidentalExplicit accid = AccidentalExplicit.NONE;
    AccidentalImplicit accidGes = AccidentalImplicit.NONE;
    String color;
    AccidentalFunction func = AccidentalFunction.NONE;
    Enclosure enclose = Enclosure.NONE;

    public Accid(Note note) {
        super(note);
    }

    protected void removeFromOwner() {
        getOwner().accid = null;
    }
    protected void addToOwner() {
        getOwner().accid = this;
    }

    public AccidentalExplicit getAccid() {
        return accid;
    }

    public void setAccid(AccidentalExplicit accid) {
        this.accid = accid;
    }

    public AccidentalImplicit getAccidGes() {
        return accidGes;
    }

    public void setAccidGes(AccidentalImplicit accidGes) {
        this.accidGes = accidGes;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public AccidentalFunction getFunc() {
        return func;
    }

    public void setFunc(AccidentalFunction func) {
        this.func = func;
    }

    public Enclosure getEnclose() {
        return enclose;
    }

    public void setEnclose(Enclosure enclose) {
        this.enclose = enclose;
    }
}
