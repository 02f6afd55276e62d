/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Editorial function of a written accidental
 */
public enum AccidentalFunction {
    CAUTION, EDIT, NONE
}
