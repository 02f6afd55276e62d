/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.annotations.AbstractClass;

@AbstractClass(subclasses = {Text.class, Rend.class})
public abstract class TextElement extends Child<TextOwner> {

    protected TextElement(TextOwner owner) {
        super(owner);
    }

    protected void removeFromOwner() {
        getOwner().removeText(this);
    }
    protected void addToOwner() {
        getOwner().addText(this);
    }
}
