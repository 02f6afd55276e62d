/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.ScoreDocument;

import java.util.List;

/**
 * Outcome of a successful import: the score tree and all warnings raised while building it
 */
public class ImportResult {
    private final ScoreDocument document;
    private final List<String> warnings;

    ImportResult(ScoreDocument document, List<String> warnings) {
        this.document = document;
        this.warnings = warnings;
    }

    public ScoreDocument getDocument() {
        return document;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
