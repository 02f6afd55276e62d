/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Connector between a syllable and the next one: underscore, elision bow or dash
 */
public enum SylConnector {
    U, B, D, NONE
}
