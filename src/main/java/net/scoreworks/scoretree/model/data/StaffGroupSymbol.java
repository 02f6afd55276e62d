/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

public enum StaffGroupSymbol {
    BRACE, BRACKET, LINE, NONE
}
