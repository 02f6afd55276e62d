/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

/**
 * Rendition of a bar line
 */
public enum BarRendition {
    DASHED, DOTTED, DBL, DBLDASHED, DBLDOTTED, END, INVIS, RPTSTART, RPTBOTH, RPTEND, SINGLE, NONE
}
