/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Score-wide definitions: the staff group hierarchy and the initial tempo
 */
public class ScoreDef extends Child<ScoreDocument> implements StaffGrpOwner {
    final List<ScoreDefElement> members = new ArrayList<>();
    Integer midiBpm;

    ScoreDef(ScoreDocument scoreDocument) {
        super(scoreDocument);
    }

    protected void removeFromOwner() {
        getOwner().scoreDef = null;
    }
    protected void addToOwner() {
        getOwner().scoreDef = this;
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

    public Integer getMidiBpm() {
        return midiBpm;
    }

    public void setMidiBpm(Integer midiBpm) {
        this.midiBpm = midiBpm;
    }
}
