/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.NumberedChild;
import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.BarRendition;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A measure holds one {@link Staff} per staff of the score and the control elements (ties, slurs, dynamics...)
 * that start in it
 */
public class Measure extends NumberedChild<Section> {
    final List<Staff> staves = new ArrayList<>();
    final List<ControlElement> controlElements = new ArrayList<>();
    BarRendition left = BarRendition.NONE;
    BarRendition right = BarRendition.NONE;

    public Measure(Section section, int n) {
        super(section, n);
    }

    /**
     * Create a detached measure, to be added to a {@link Section} once its content is read
     */
    public Measure(RootEntity root, int n) {
        super(root, n);
    }

    protected void removeFromOwner() {
        getOwner().measures.remove(this);
    }
    protected void addToOwner() {
        getOwner().measures.add(this);
    }

    public List<Staff> getStaves() {
        return Collections.unmodifiableList(staves);
    }

    public Staff getStaff(int idx) {
        return staves.get(idx);
    }

    public int getStaffCount() {
        return staves.size();
    }

    /**
     * @return the staff with the given number or null
     */
    public @Nullable Staff findStaff(int n) {
        for (Staff staff : staves) {
            if (staff.getN() == n)
                return staff;
        }
        return null;
    }

    /**
     * Move all staves of another measure into this one. The other measure is left empty
     */
    public void moveStavesFrom(Measure other) {
        for (Staff staff : new ArrayList<>(other.staves)) {
            staff.attachTo(this);
        }
    }

    public List<ControlElement> getControlElements() {
        return Collections.unmodifiableList(controlElements);
    }

    public <T extends ControlElement> List<T> getControlElements(Class<T> clazz) {
        List<T> found = new ArrayList<>();
        for (ControlElement controlElement : controlElements) {
            if (clazz.isInstance(controlElement))
                found.add(clazz.cast(controlElement));
        }
        return found;
    }

    public BarRendition getLeft() {
        return left;
    }

    public void setLeft(BarRendition left) {
        this.left = left;
    }

    public BarRendition getRight() {
        return right;
    }

    public void setRight(BarRendition right) {
        this.right = right;
    }
}
