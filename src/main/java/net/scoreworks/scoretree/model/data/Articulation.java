/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model.data;

public enum Articulation {
    ACC, TEN_STACC, SPICC, STACCISS, STACC, MARC, TEN, DNBOW, HARM, OPEN, SNAP, STOP, UPBOW
}
