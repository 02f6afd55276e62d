/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.NumberedChild;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lyric line of a note, numbered by the verse
 */
public class Verse extends NumberedChild<Note> {
    final List<Syl> syls = new ArrayList<>();
    String color;

    public Verse(Note note, int n) {
        super(note, n);
    }

    protected void removeFromOwner() {
        getOwner().verses.remove(this);
    }
    protected void addToOwner() {
        getOwner().verses.add(this);
    }

    public List<Syl> getSyls() {
        return Collections.unmodifiableList(syls);
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }
}
