/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

public enum FontStyle {
    ITALIC, NORMAL, OBLIQUE, NONE
}
