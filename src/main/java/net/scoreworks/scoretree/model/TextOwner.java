/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.ScoreObject;

import java.util.List;

/**
 * Owner of text content: syllables, directions, tempo marks and renditions
 */
public interface TextOwner extends ScoreObject {

    List<TextElement> getTexts();

    void addText(TextElement text);

    void removeText(TextElement text);

    /**
     * @return all text of this owner and its renditions, concatenated
     */
    default String getPlainText() {
        StringBuilder strb = new StringBuilder();
        for (TextElement element : getTexts()) {
            if (element instanceof Text)
                strb.append(((Text) element).getText());
            else
                strb.append(((Rend) element).getPlainText());
        }
        return strb.toString();
    }
}
