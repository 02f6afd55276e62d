/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.Grace;
import net.scoreworks.scoretree.model.data.PitchName;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pitched note. If the note sounds at another octave than written (under an octave shift), the sounding octave
 * is stored in {@link #getOctGes()}
 */
public class Note extends StemmedElement {
    final List<Verse> verses = new ArrayList<>();
    Accid accid;
    PitchName pname = PitchName.NONE;
    int oct;
    Integer octGes;
    boolean visible = true;
    String color;
    Grace grace = Grace.NONE;

    public Note(LayerElementOwner owner) {
        super(owner);
    }

    /**
     * @return the chord of this note or null
     */
    public @Nullable Chord getChord() {
        return getOwner() instanceof Chord ? (Chord) getOwner() : null;
    }

    public @Nullable Accid getAccid() {
        return accid;
    }

    public List<Verse> getVerses() {
        return Collections.unmodifiableList(verses);
    }

    public PitchName getPname() {
        return pname;
    }

    public void setPname(PitchName pname) {
        this.pname = pname;
    }

    public int getOct() {
        return oct;
    }

    public void setOct(int oct) {
        this.oct = oct;
    }

    public Integer getOctGes() {
        return octGes;
    }

    public void setOctGes(Integer octGes) {
        this.octGes = octGes;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public Grace getGrace() {
        return grace;
    }

    public void setGrace(Grace grace) {
        this.grace = grace;
    }
}
