/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.annotations.AbstractClass;
import net.scoreworks.scoretree.model.data.StaffRel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all elements that are not part of a layer but refer to layer elements by their identity, like ties,
 * slurs or dynamics. A control element is owned by the {@link Measure} it starts in. It is usually created detached
 * while its measure is still being read and attached once the measure is known.
 * <p>
 * {@link #getStartId()} and {@link #getEndId()} hold references in the form {@code #<id>}, see
 * {@link net.scoreworks.scoretree.ScoreObject#getReference()}
 */
@AbstractClass(subclasses = {Dir.class, Dynam.class, Fermata.class, Hairpin.class, Harm.class, Mordent.class,
        Octave.class, Pedal.class, Slur.class, Tempo.class, Tie.class, Trill.class, Turn.class})
public abstract class ControlElement extends Child<Measure> {
    final List<Integer> staff = new ArrayList<>();
    String startId;
    String endId;
    Double tstamp;
    String color;
    StaffRel place = StaffRel.NONE;

    protected ControlElement(RootEntity root) {
        super(root);
    }

    protected void removeFromOwner() {
        getOwner().controlElements.remove(this);
    }
    protected void addToOwner() {
        getOwner().controlElements.add(this);
    }

    /**
     * @return the global numbers of the staves this element applies to
     */
    public List<Integer> getStaff() {
        return Collections.unmodifiableList(staff);
    }

    public void setStaff(int n) {
        staff.clear();
        staff.add(n);
    }

    public String getStartId() {
        return startId;
    }

    public void setStartId(String startId) {
        this.startId = startId;
    }

    public String getEndId() {
        return endId;
    }

    public void setEndId(String endId) {
        this.endId = endId;
    }

    public Double getTstamp() {
        return tstamp;
    }

    public void setTstamp(Double tstamp) {
        this.tstamp = tstamp;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public StaffRel getPlace() {
        return place;
    }

    public void setPlace(StaffRel place) {
        this.place = place;
    }
}
