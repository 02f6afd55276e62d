/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * How the number of a tuplet is rendered, {@link #COUNT} shows the actual notes only
 */
public enum TupletNumberFormat {
    COUNT, RATIO, NONE
}
