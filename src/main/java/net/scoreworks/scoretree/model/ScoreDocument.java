/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of an imported score. Holds the score definition with the staff groups and the sections with the music
 */
public class ScoreDocument extends RootEntity {
    ScoreDef scoreDef;
    final List<Section> sections = new ArrayList<>();

    public ScoreDocument() {
        new ScoreDef(this);
    }

    public ScoreDef getScoreDef() {
        return scoreDef;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public Section getSection(int idx) {
        return sections.get(idx);
    }
}
