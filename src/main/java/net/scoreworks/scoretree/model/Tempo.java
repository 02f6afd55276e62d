/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;
import net.scoreworks.scoretree.model.data.Duration;

/**
 * Tempo marking with optional metronome indication
 */
public class Tempo extends TextControlElement {
    String lang;
    Integer mm;
    Duration mmUnit = Duration.NONE;
    int mmDots;
    Integer midiBpm;

    public Tempo(RootEntity root) {
        super(root);
    }

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }

    public Integer getMm() {
        return mm;
    }

    public void setMm(Integer mm) {
        this.mm = mm;
    }

    public Duration getMmUnit() {
        return mmUnit;
    }

    public void setMmUnit(Duration mmUnit) {
        this.mmUnit = mmUnit;
    }

    public int getMmDots() {
        return mmDots;
    }

    public void setMmDots(int mmDots) {
        this.mmDots = mmDots;
    }

    public Integer getMidiBpm() {
        return midiBpm;
    }

    public void setMidiBpm(Integer midiBpm) {
        this.midiBpm = midiBpm;
    }
}
