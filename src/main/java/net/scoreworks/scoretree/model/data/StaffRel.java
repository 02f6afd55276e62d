/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Placement relative to the staff
 */
public enum StaffRel {
    ABOVE, BELOW, BETWEEN, WITHIN, NONE
}
