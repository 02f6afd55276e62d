/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

/**
 * Child entity that is identified within its owner by a final positive number, like the {@code n} of measures,
 * staves and layers. Cross-references between parts of the score use this number rather than the object itself.
 * @param <O> class-type of the owner class
 */
public abstract class NumberedChild<O extends ScoreObject> extends Child<O> {

    /**
     * The number this object is identified with
     */
    private final int n;

    public NumberedChild(O owner, int n) {
        super(owner);
        this.n = n;
        addToOwner();   // now n can be used
    }

    /**
     * Create a detached numbered child
     */
    public NumberedChild(RootEntity root, int n) {
        super(root);
        this.n = n;
    }

    public int getN() {
        return n;
    }

    @Override
    protected boolean isDirectChild() {
        return false;
    }
}
