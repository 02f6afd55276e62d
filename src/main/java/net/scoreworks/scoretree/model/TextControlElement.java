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
 * Control element carrying text
 */
public abstract class TextControlElement extends ControlElement implements TextOwner {
    final List<TextElement> texts = new ArrayList<>();

    protected TextControlElement(RootEntity root) {
        super(root);
    }

    @Override
    public List<TextElement> getTexts() {
        return Collections.unmodifiableList(texts);
    }
    @Override
    public void addText(TextElement text) {
        texts.add(text);
    }
    @Override
    public void removeText(TextElement text) {
        texts.remove(text);
    }
}
