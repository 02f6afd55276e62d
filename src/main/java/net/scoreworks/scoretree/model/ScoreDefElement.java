/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.annotations.AbstractClass;

@AbstractClass(subclasses = {StaffGrp.class, StaffDef.class})
public abstract class ScoreDefElement extends Child<StaffGrpOwner> {

    protected ScoreDefElement(StaffGrpOwner owner) {
        super(owner);
    }

    protected ScoreDefElement(RootEntity root) {
        super(root);
    }

    protected void removeFromOwner() {
        getOwner().removeMember(this);
    }
    protected void addToOwner() {
        getOwner().addMember(this);
    }
}
