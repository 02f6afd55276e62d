/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Boolean that can be left unset
 */
public enum BooleanValue {
    TRUE, FALSE, NONE
}
