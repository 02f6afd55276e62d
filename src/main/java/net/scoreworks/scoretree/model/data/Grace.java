/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Grace note classification. {@link #ACC} is an appoggiatura, {@link #UNACC} an acciaccatura
 */
public enum Grace {
    ACC, UNACC, UNKNOWN, NONE
}
