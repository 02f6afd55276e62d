/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.RootEntity;

/**
 * Textual direction
 */
public class Dir extends TextControlElement {
    String lang;

    public Dir(RootEntity root) {
        super(root);
    }

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }
}
