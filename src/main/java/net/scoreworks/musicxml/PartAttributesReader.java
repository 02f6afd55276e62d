/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.StaffDef;
import net.scoreworks.scoretree.model.StaffGrp;
import net.scoreworks.scoretree.model.data.KeySignature;
import net.scoreworks.scoretree.model.data.MeterRendition;
import net.scoreworks.scoretree.model.data.MeterSign;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.Place;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import static net.scoreworks.musicxml.XmlNavigator.attribute;
import static net.scoreworks.musicxml.XmlNavigator.childContent;
import static net.scoreworks.musicxml.XmlNavigator.childElements;
import static net.scoreworks.musicxml.XmlNavigator.content;
import static net.scoreworks.musicxml.XmlNavigator.toDouble;
import static net.scoreworks.musicxml.XmlNavigator.toInt;

/**
 * Reads the staff definitions of a part from the elements at the beginning of its first measure
 */
class PartAttributesReader {
    private static final Logger log = LoggerFactory.getLogger(PartAttributesReader.class);

    /** elements that may precede the first event of a measure */
    private static final String[] LEADING_ELEMENTS = {"attributes", "barline", "print", "sound"};

    private final ImportSession session;
    private final XmlNavigator nav;

    PartAttributesReader(ImportSession session) {
        this.session = session;
        this.nav = session.navigator;
    }

    /**
     * Create or update one staff definition per staff of the part. Staff definitions are numbered after the staves
     * of previous parts.
     * @param firstMeasure first measure of the part
     * @param staffGrp group to add the staff definitions to
     * @param staffOffset number of staves of all previous parts
     * @return the number of staves of the part
     */
    int readStaffDefs(Element firstMeasure, StaffGrp staffGrp, int staffOffset) {
        int nbStaves = 1;
        for (Element it : childElements(firstMeasure)) {
            if (!ArrayUtils.contains(LEADING_ELEMENTS, it.getNodeName()))
                break;
            //the measure reader must not read these again as changes within the measure
            if ("attributes".equals(it.getNodeName()))
                session.markConsumed(it);

            Element staves = nav.select(it, "staves");
            if (staves != null && !content(staves).isEmpty()) {
                int value = toInt(content(staves));
                nbStaves = value > 0 ? value : 1;
            }

            for (int i = 0; i < nbStaves; i++) {
                int n = i + 1 + staffOffset;
                StaffDef staffDef = staffGrp.findStaffDef(n);
                if (staffDef == null) {
                    staffDef = new StaffDef(staffGrp, n);
                    session.stacks.setOctaveDisplacement(n, 0);
                }
                readClef(it, i + 1, staffDef);
                readKey(it, i + 1, staffDef);
                readStaffDetails(it, i + 1, staffDef);
                readTime(it, i + 1, staffDef);
                readTranspose(it, i + 1, staffDef);
                Element divisions = nav.select(it, "divisions");
                if (divisions != null)
                    session.setPpq(toInt(content(divisions)));
            }
        }
        log.debug("Part {} declares {} staves", session.getPartId(), nbStaves);
        return nbStaves;
    }

    /**
     * Select an element of the attributes that applies to a staff. An element numbered with the staff is preferred
     * over an element without number, elements numbered for another staff never apply
     */
    private @Nullable Element forStaff(Element attributes, String name, int staffNum, String subPath) {
        Element found = nav.select(attributes, name + "[@number='" + staffNum + "']" + subPath);
        if (found == null)
            found = nav.select(attributes, name + "[not(@number)]" + subPath);
        return found;
    }

    private void readClef(Element attributes, int staffNum, StaffDef staffDef) {
        Element sign = forStaff(attributes, "clef", staffNum, "/sign");
        if (sign != null && !content(sign).isEmpty())
            staffDef.setClefShape(session.converters.clefShape(content(sign)));
        Element line = forStaff(attributes, "clef", staffNum, "/line");
        if (line != null && !content(line).isEmpty())
            staffDef.setClefLine(toInt(content(line)));
        Element octaveChange = forStaff(attributes, "clef", staffNum, "/clef-octave-change");
        if (octaveChange != null && !content(octaveChange).isEmpty()) {
            int change = toInt(content(octaveChange));
            if (Math.abs(change) == 1)
                staffDef.setClefDis(OctaveDisplacement.EIGHT);
            else if (Math.abs(change) == 2)
                staffDef.setClefDis(OctaveDisplacement.FIFTEEN);
            if (change < 0)
                staffDef.setClefDisPlace(Place.BELOW);
            else if (change > 0)
                staffDef.setClefDisPlace(Place.ABOVE);
        }
    }

    private void readKey(Element attributes, int staffNum, StaffDef staffDef) {
        Element key = forStaff(attributes, "key", staffNum, "");
        if (key == null)
            return;
        Element fifths = nav.select(key, "fifths");
        if (fifths != null)
            staffDef.setKeySig(KeySignature.ofFifths(toInt(content(fifths))));
        else if (nav.exists(key, "key-step"))
            staffDef.setKeySig(KeySignature.MIXED);
        Element mode = nav.select(key, "mode");
        if (mode != null)
            staffDef.setKeyMode(session.converters.keyMode(content(mode)));
    }

    private void readStaffDetails(Element attributes, int staffNum, StaffDef staffDef) {
        Element staffDetails = forStaff(attributes, "staff-details", staffNum, "");
        if (staffDetails == null)
            return;
        String lines = childContent(staffDetails, "staff-lines");
        staffDef.setLines(lines.isEmpty() ? 5 : toInt(lines));
        String scale = childContent(staffDetails, "staff-size");
        if (!scale.isEmpty())
            staffDef.setScale((int) toDouble(scale));
        if (nav.exists(staffDetails, "staff-tuning"))
            staffDef.setTablature(true);
    }

    private void readTime(Element attributes, int staffNum, StaffDef staffDef) {
        Element time = forStaff(attributes, "time", staffNum, "");
        if (time == null)
            return;
        String symbol = attribute(time, "symbol");
        if ("cut".equals(symbol))
            staffDef.setMeterSign(MeterSign.CUT);
        else if ("common".equals(symbol))
            staffDef.setMeterSign(MeterSign.COMMON);
        else if ("single-number".equals(symbol))
            staffDef.setMeterRendition(MeterRendition.NUM);
        else if (!symbol.isEmpty())
            staffDef.setMeterRendition(MeterRendition.NORM);

        if (nav.selectAll(time, "beats").size() > 1)
            session.diagnostics.warn("Compound meter signatures are not supported");
        Element beats = nav.select(time, "beats");
        if (beats != null && !content(beats).isEmpty()) {
            String value = content(beats);
            int meterCount = 0;
            //additive meters like 3+2 are summed up
            for (String summand : StringUtils.split(value, '+'))
                meterCount += toInt(summand);
            if (value.contains("+"))
                session.diagnostics.warn("Compound time is not supported");
            session.setMeterCount(meterCount);
            staffDef.setMeterCount(meterCount);
        }
        Element beatType = nav.select(time, "beat-type");
        if (beatType != null && !content(beatType).isEmpty())
            staffDef.setMeterUnit(toInt(content(beatType)));
    }

    private void readTranspose(Element attributes, int staffNum, StaffDef staffDef) {
        Element transpose = forStaff(attributes, "transpose", staffNum, "");
        if (transpose == null)
            return;
        staffDef.setTransDiat(toInt(childContent(transpose, "diatonic")));
        staffDef.setTransSemi(toInt(childContent(transpose, "chromatic")));
    }
}
