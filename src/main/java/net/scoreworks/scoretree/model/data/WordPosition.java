/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Position of a syllable within its word: initial, medial or terminal
 */
public enum WordPosition {
    I, M, T, NONE
}
