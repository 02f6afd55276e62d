/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.ScoreObject;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Owner of {@link ScoreDefElement}s. The member list is maintained by the members themselves when they are attached
 * or removed, {@link #addMember(ScoreDefElement)} and {@link #removeMember(ScoreDefElement)} are not meant to be
 * called from anywhere else
 */
public interface StaffGrpOwner extends ScoreObject {

    List<ScoreDefElement> getMembers();

    void addMember(ScoreDefElement member);

    void removeMember(ScoreDefElement member);

    /**
     * Find a staff definition by its number anywhere below this owner
     */
    default @Nullable StaffDef findStaffDef(int n) {
        for (ScoreDefElement member : getMembers()) {
            if (member instanceof StaffDef && ((StaffDef) member).getN() == n)
                return (StaffDef) member;
            if (member instanceof StaffGrp) {
                StaffDef found = ((StaffGrp) member).findStaffDef(n);
                if (found != null)
                    return found;
            }
        }
        return null;
    }
}
