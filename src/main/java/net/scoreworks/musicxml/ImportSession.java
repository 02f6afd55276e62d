/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.ScoreDocument;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * All mutable state of one import. A session is created per import call and never shared, so the readers using it
 * hold no state of their own besides the session
 */
class ImportSession {
    final ImportSettings settings;
    final ImportDiagnostics diagnostics = new ImportDiagnostics();
    final MusicXmlConverters converters = new MusicXmlConverters(diagnostics);
    final CrossReferenceStacks stacks = new CrossReferenceStacks(diagnostics);
    final XmlNavigator navigator = new XmlNavigator();
    final ScoreDocument document = new ScoreDocument();

    /**
     * attributes elements already read as staff definitions
     */
    private final Set<Element> consumedAttributes = Collections.newSetFromMap(new IdentityHashMap<>());

    /** divisions per quarter note, taken from the last divisions element read */
    private int ppq = 1;

    /** beats of the last time signature read */
    private int meterCount;

    private boolean measureRepeat;

    /** running duration of the measure being read, in divisions */
    private int durTotal;

    /** reference of the last event read */
    private String lastReference;

    private String partId;

    private int staffOffset;

    ImportSession(ImportSettings settings) {
        this.settings = settings;
    }

    void markConsumed(Element attributes) {
        consumedAttributes.add(attributes);
    }

    boolean isConsumed(Element attributes) {
        return consumedAttributes.contains(attributes);
    }

    int getPpq() {
        return ppq;
    }

    void setPpq(int ppq) {
        this.ppq = ppq;
    }

    int getMeterCount() {
        return meterCount;
    }

    void setMeterCount(int meterCount) {
        this.meterCount = meterCount;
    }

    boolean isMeasureRepeat() {
        return measureRepeat;
    }

    void setMeasureRepeat(boolean measureRepeat) {
        this.measureRepeat = measureRepeat;
    }

    int getDurTotal() {
        return durTotal;
    }

    void resetDurTotal() {
        durTotal = 0;
    }

    void addDuration(int duration) {
        durTotal += duration;
    }

    String getLastReference() {
        return lastReference;
    }

    void setLastReference(String lastReference) {
        this.lastReference = lastReference;
    }

    String getPartId() {
        return partId;
    }

    int getStaffOffset() {
        return staffOffset;
    }

    /**
     * Start reading a part whose staves follow the given number of staves of previous parts
     */
    void startPart(String partId, int staffOffset) {
        this.partId = partId;
        this.staffOffset = staffOffset;
        diagnostics.setLocation(partId, null);
    }
}
