/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree.model;

import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.KeyMode;
import net.scoreworks.scoretree.model.data.KeySignature;
import net.scoreworks.scoretree.model.data.MeterRendition;
import net.scoreworks.scoretree.model.data.MeterSign;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.Place;

/**
 * Initial definition of one staff: clef, key, meter, transposition and staff properties
 */
public class StaffDef extends ScoreDefElement {
    private final int n;
    String label;
    String labelAbbr;
    ClefShape clefShape = ClefShape.NONE;
    Integer clefLine;
    OctaveDisplacement clefDis = OctaveDisplacement.NONE;
    Place clefDisPlace = Place.NONE;
    KeySignature keySig;
    KeyMode keyMode = KeyMode.NONE;
    int lines = 5;
    Integer scale;
    boolean tablature;
    MeterSign meterSign = MeterSign.NONE;
    MeterRendition meterRendition = MeterRendition.NONE;
    Integer meterCount;
    Integer meterUnit;
    Integer transDiat;
    Integer transSemi;

    public StaffDef(StaffGrpOwner owner, int n) {
        super(owner);
        this.n = n;
        addToOwner();   // now n can be used
    }

    @Override
    protected boolean isDirectChild() {
        return false;
    }

    public int getN() {
        return n;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getLabelAbbr() {
        return labelAbbr;
    }

    public void setLabelAbbr(String labelAbbr) {
        this.labelAbbr = labelAbbr;
    }

    public ClefShape getClefShape() {
        return clefShape;
    }

    public void setClefShape(ClefShape clefShape) {
        this.clefShape = clefShape;
    }

    public Integer getClefLine() {
        return clefLine;
    }

    public void setClefLine(Integer clefLine) {
        this.clefLine = clefLine;
    }

    public OctaveDisplacement getClefDis() {
        return clefDis;
    }

    public void setClefDis(OctaveDisplacement clefDis) {
        this.clefDis = clefDis;
    }

    public Place getClefDisPlace() {
        return clefDisPlace;
    }

    public void setClefDisPlace(Place clefDisPlace) {
        this.clefDisPlace = clefDisPlace;
    }

    public KeySignature getKeySig() {
        return keySig;
    }

    public void setKeySig(KeySignature keySig) {
        this.keySig = keySig;
    }

    public KeyMode getKeyMode() {
        return keyMode;
    }

    public void setKeyMode(KeyMode keyMode) {
        this.keyMode = keyMode;
    }

    public int getLines() {
        return lines;
    }

    public void setLines(int lines) {
        this.lines = lines;
    }

    /**
     * @return staff size in percent of the normal size, or null if not set
     */
    public Integer getScale() {
        return scale;
    }

    public void setScale(Integer scale) {
        this.scale = scale;
    }

    public boolean isTablature() {
        return tablature;
    }

    public void setTablature(boolean tablature) {
        this.tablature = tablature;
    }

    public MeterSign getMeterSign() {
        return meterSign;
    }

    public void setMeterSign(MeterSign meterSign) {
        this.meterSign = meterSign;
    }

    public MeterRendition getMeterRendition() {
        return meterRendition;
    }

    public void setMeterRendition(MeterRendition meterRendition) {
        this.meterRendition = meterRendition;
    }

    public Integer getMeterCount() {
        return meterCount;
    }

    public void setMeterCount(Integer meterCount) {
        this.meterCount = meterCount;
    }

    public Integer getMeterUnit() {
        return meterUnit;
    }

    public void setMeterUnit(Integer meterUnit) {
        this.meterUnit = meterUnit;
    }

    public Integer getTransDiat() {
        return transDiat;
    }

    public void setTransDiat(Integer transDiat) {
        this.transDiat = transDiat;
    }

    public Integer getTransSemi() {
        return transSemi;
    }

    public void setTransSemi(Integer transSemi) {
        this.transSemi = transSemi;
    }
}
