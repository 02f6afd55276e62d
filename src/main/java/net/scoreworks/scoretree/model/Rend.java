/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.FontStyle;
import net.scoreworks.scoretree.model.data.FontWeight;
import net.scoreworks.scoretree.model.data.HorizontalAlignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formatted text run. Only created when the text carries formatting of its own
 */
public class Rend extends TextElement implements TextOwner {
    final List<TextElement> texts = new ArrayList<>();
    String lang;
    HorizontalAlignment halign = HorizontalAlignment.NONE;
    String color;
    String fontFamily;
    FontStyle fontStyle = FontStyle.NONE;
    FontWeight fontWeight = FontWeight.NONE;

    public Rend(TextOwner owner) {
        super(owner);
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

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }

    public HorizontalAlignment getHalign() {
        return halign;
    }

    public void setHalign(HorizontalAlignment halign) {
        this.halign = halign;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public FontStyle getFontStyle() {
        return fontStyle;
    }

    public void setFontStyle(FontStyle fontStyle) {
        this.fontStyle = fontStyle;
    }

    public FontWeight getFontWeight() {
        return fontWeight;
    }

    public void setFontWeight(FontWeight fontWeight) {
        this.fontWeight = fontWeight;
    }
}
