/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.StaffGroupSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Group of staves, possibly nested. Groups come from part-groups and from parts with more than one staff
 */
public class StaffGrp extends ScoreDefElement implements StaffGrpOwner {
    final List<ScoreDefElement> members = new ArrayList<>();
    StaffGroupSymbol symbol = StaffGroupSymbol.NONE;
    BooleanValue barThru = BooleanValue.NONE;
    String label;
    String labelAbbr;

    public StaffGrp(StaffGrpOwner owner) {
        super(owner);
    }

    /**
     * Create a detached group
     */
    public StaffGrp(RootEntity root) {
        super(root);
    }

    @Override
    public List<ScoreDefElement> getMembers() {
        return Collections.unmodifiableList(members);
    }
    @Override
    public void addMember(ScoreDefElement member) {
        members.add(member);
    }
    @Override
    public void removeMember(ScoreDefElement member) {
        members.remove(member);
    }

    /**
     * Move all members of another group into this one, keeping their order
     */
    public void moveMembersFrom(StaffGrp other) {
        for (ScoreDefElement member : new ArrayList<>(other.members)) {
            member.attachTo(this);
        }
    }

    public StaffGroupSymbol getSymbol() {
        return symbol;
    }

    public void setSymbol(StaffGroupSymbol symbol) {
        this.symbol = symbol;
    }

    public BooleanValue getBarThru() {
        return barThru;
    }

    public void setBarThru(BooleanValue barThru) {
        this.barThru = barThru;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getLabelAbbr() {
        return labelAbbr;
    }

    public void setLabelAbbr(String labelAbbr) {
        this.labelAbbr = labelAbbr;
    }
}
