/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.Child;
import net.scoreworks.scoretree.model.data.FontStyle;
import net.scoreworks.scoretree.model.data.FontWeight;
import net.scoreworks.scoretree.model.data.SylConnector;
import net.scoreworks.scoretree.model.data.WordPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Syllable of a verse
 */
public class Syl extends Child<Verse> implements TextOwner {
    final List<TextElement> texts = new ArrayList<>();
    String lang;
    SylConnector con = SylConnector.NONE;
    WordPosition wordPos = WordPosition.NONE;
    FontStyle fontStyle = FontStyle.NONE;
    FontWeight fontWeight = FontWeight.NONE;

    public Syl(Verse verse) {
        super(verse);
    }

    protected void removeFromOwner() {
        getOwner().syls.remove(this);
    }
    protected void addToOwner() {
        getOwner().syls.add(this);
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

    public SylConnector getCon() {
        return con;
    }

    public void setCon(SylConnector con) {
        this.con = con;
    }

    public WordPosition getWordPos() {
        return wordPos;
    }

    public void setWordPos(WordPosition wordPos) {
        this.wordPos = wordPos;
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
