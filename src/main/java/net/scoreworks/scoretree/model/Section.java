/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Section extends Child<ScoreDocument> {
    final List<Measure> measures = new ArrayList<>();

    public Section(ScoreDocument scoreDocument) {
        super(scoreDocument);
    }

    protected void removeFromOwner() {
        getOwner().sections.remove(this);
    }
    protected void addToOwner() {
        getOwner().sections.add(this);
    }

    public List<Measure> getMeasures() {
        return Collections.unmodifiableList(measures);
    }

    public Measure getMeasure(int idx) {
        return measures.get(idx);
    }

    public int getMeasureCount() {
        return measures.size();
    }

    /**
     * @return the first measure with the given number or null
     */
    public @Nullable Measure findMeasure(int n) {
        for (Measure measure : measures) {
            if (measure.getN() == n)
                return measure;
        }
        return null;
    }
}
