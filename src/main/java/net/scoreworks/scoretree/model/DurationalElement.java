/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.Duration;

/**
 * Event with a written duration
 */
public abstract class DurationalElement extends LayerElement {
    Duration dur = Duration.NONE;
    int dots;
    boolean cue;

    protected DurationalElement(LayerElementOwner owner) {
        super(owner);
    }

    public Duration getDur() {
        return dur;
    }

    public void setDur(Duration dur) {
        this.dur = dur;
    }

    public int getDots() {
        return dots;
    }

    public void setDots(int dots) {
        this.dots = dots;
    }

    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }
}
