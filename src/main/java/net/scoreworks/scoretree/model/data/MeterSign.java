/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Symbol replacing the numbers of a meter signature
 */
public enum MeterSign {
    COMMON, CUT, NONE
}
