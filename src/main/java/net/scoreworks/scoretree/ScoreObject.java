/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

/**
 * Base interface for any node of a score tree. Every node belongs to exactly one {@link RootEntity} and can be
 * referenced from anywhere in that tree by its {@link ObjectId}
 */
public interface ScoreObject {

    /**
     * @return the root of the score tree
     */
    RootEntity getRootEntity();

    /**
     * @return the stable identity of this object. It is assigned on first request and never changes afterwards
     */
    ObjectId getId();

    /**
     * @return a reference to this object in the form {@code #identity}, as used by start and end anchors
     */
    default String getReference() {
        return "#" + getId();
    }
}
