/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Form of mordents and turns
 */
public enum OrnamentForm {
    NORM, INV
}
