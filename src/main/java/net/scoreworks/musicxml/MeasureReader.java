/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.musicxml.CrossReferenceStacks.PendingKind;
import net.scoreworks.scoretree.model.Accid;
import net.scoreworks.scoretree.model.Artic;
import net.scoreworks.scoretree.model.BTrem;
import net.scoreworks.scoretree.model.Beam;
import net.scoreworks.scoretree.model.Chord;
import net.scoreworks.scoretree.model.Clef;
import net.scoreworks.scoretree.model.ControlElement;
import net.scoreworks.scoretree.model.Dir;
import net.scoreworks.scoretree.model.Dynam;
import net.scoreworks.scoretree.model.FTrem;
import net.scoreworks.scoretree.model.Fermata;
import net.scoreworks.scoretree.model.Hairpin;
import net.scoreworks.scoretree.model.Harm;
import net.scoreworks.scoretree.model.Layer;
import net.scoreworks.scoretree.model.LayerElement;
import net.scoreworks.scoretree.model.MRest;
import net.scoreworks.scoretree.model.MRpt;
import net.scoreworks.scoretree.model.Measure;
import net.scoreworks.scoretree.model.Mordent;
import net.scoreworks.scoretree.model.Note;
import net.scoreworks.scoretree.model.Octave;
import net.scoreworks.scoretree.model.Pedal;
import net.scoreworks.scoretree.model.Rend;
import net.scoreworks.scoretree.model.Rest;
import net.scoreworks.scoretree.model.Slur;
import net.scoreworks.scoretree.model.Space;
import net.scoreworks.scoretree.model.Staff;
import net.scoreworks.scoretree.model.StemmedElement;
import net.scoreworks.scoretree.model.Syl;
import net.scoreworks.scoretree.model.Tempo;
import net.scoreworks.scoretree.model.Text;
import net.scoreworks.scoretree.model.TextOwner;
import net.scoreworks.scoretree.model.Tie;
import net.scoreworks.scoretree.model.Trill;
import net.scoreworks.scoretree.model.Tuplet;
import net.scoreworks.scoretree.model.Turn;
import net.scoreworks.scoretree.model.Verse;
import net.scoreworks.scoretree.model.data.AccidentalFunction;
import net.scoreworks.scoretree.model.data.Articulation;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.Enclosure;
import net.scoreworks.scoretree.model.data.FermataForm;
import net.scoreworks.scoretree.model.data.Grace;
import net.scoreworks.scoretree.model.data.HairpinForm;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.OrnamentForm;
import net.scoreworks.scoretree.model.data.Place;
import net.scoreworks.scoretree.model.data.StaffRel;
import net.scoreworks.scoretree.model.data.StemDirection;
import net.scoreworks.scoretree.model.data.StemModifier;
import net.scoreworks.scoretree.model.data.SylConnector;
import net.scoreworks.scoretree.model.data.WordPosition;
import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.List;

import static net.scoreworks.musicxml.XmlNavigator.attribute;
import static net.scoreworks.musicxml.XmlNavigator.child;
import static net.scoreworks.musicxml.XmlNavigator.childContent;
import static net.scoreworks.musicxml.XmlNavigator.childElements;
import static net.scoreworks.musicxml.XmlNavigator.children;
import static net.scoreworks.musicxml.XmlNavigator.content;
import static net.scoreworks.musicxml.XmlNavigator.firstChildElement;
import static net.scoreworks.musicxml.XmlNavigator.hasAttributeValue;
import static net.scoreworks.musicxml.XmlNavigator.nextSibling;
import static net.scoreworks.musicxml.XmlNavigator.previousSibling;
import static net.scoreworks.musicxml.XmlNavigator.toDouble;
import static net.scoreworks.musicxml.XmlNavigator.toInt;

/**
 * Reads the content of one measure of a part into a new {@link Measure}. Events go to the layer of their staff and
 * voice, or into the innermost open container of that layer. Control elements are only collected, they are added
 * to their measures after all parts are read.
 */
class MeasureReader {
    private static final Logger log = LoggerFactory.getLogger(MeasureReader.class);

    private final ImportSession session;
    private final XmlNavigator nav;
    private final CrossReferenceStacks stacks;
    private final MusicXmlConverters converters;
    private final ImportDiagnostics diagnostics;

    MeasureReader(ImportSession session) {
        this.session = session;
        this.nav = session.navigator;
        this.stacks = session.stacks;
        this.converters = session.converters;
        this.diagnostics = session.diagnostics;
    }

    /**
     * Read a measure of the current part. The returned measure is detached, it holds one staff per staff of the part
     * @param node measure element
     * @param nbStaves number of staves of the part
     * @param staffOffset number of staves of all previous parts
     */
    Measure readMeasure(Element node, int nbStaves, int staffOffset) {
        int measureN = toInt(attribute(node, "number"));
        diagnostics.setLocation(session.getPartId(), measureN);
        Measure measure = new Measure(session.document, measureN);
        for (int i = 0; i < nbStaves; i++) {
            //layers are created on demand by selectLayer()
            new Staff(measure, i + 1 + staffOffset);
        }

        stacks.clearElements();
        session.resetDurTotal();

        for (Element it : childElements(node)) {
            if (session.settings.isVerbose())
                log.info("Measure {}: {}", measureN, it.getNodeName());
            else
                log.debug("Measure {}: {}", measureN, it.getNodeName());
            switch (it.getNodeName()) {
                case "attributes":
                    readAttributes(it, measure);
                    break;
                case "backup":
                    readBackup(it, measure);
                    break;
                case "barline":
                    readBarline(it, measure, measureN);
                    break;
                case "direction":
                    readDirection(it, measureN);
                    break;
                case "forward":
                    readForward(it, measure);
                    break;
                case "harmony":
                    readHarmony(it, measureN);
                    break;
                case "note":
                    readNote(it, measure, measureN);
                    break;
                case "print":
                    //layout only
                    break;
                default:
                    break;
            }
        }
        if (stacks.hasOpenElements())
            diagnostics.warn("{} beam, tuplet, chord or tremolo containers are still open at the end of the measure",
                    stacks.getOpenElementCount());
        return measure;
    }


    //==========LAYERS====================================================

    /**
     * Select the layer for an element with optional staff and voice children. The layer is created if the staff
     * has no layer of that voice yet
     */
    Layer selectLayer(Element node, Measure measure) {
        int staffNum = 1;
        String staffNumStr = childContent(node, "staff");
        if (!staffNumStr.isEmpty())
            staffNum = toInt(staffNumStr);
        if (staffNum < 1 || staffNum > measure.getStaffCount()) {
            diagnostics.warn("Staff {} cannot be found", staffNum);
            staffNum = 1;
        }
        Staff staff = measure.getStaff(staffNum - 1);
        int layerNum = 1;
        String layerNumStr = childContent(node, "voice");
        if (!layerNumStr.isEmpty())
            layerNum = toInt(layerNumStr);
        if (layerNum < 1) {
            diagnostics.warn("Voice {} cannot be found", layerNum);
            layerNum = 1;
        }
        Layer layer = staff.findLayer(layerNum);
        return layer != null ? layer : new Layer(staff, layerNum);
    }

    /**
     * Select the first layer of a staff, given by its number within the part
     */
    Layer selectFirstLayer(int staffNum, Measure measure) {
        if (staffNum < 1 || staffNum > measure.getStaffCount()) {
            diagnostics.warn("Staff {} cannot be found", staffNum);
            staffNum = 1;
        }
        Staff staff = measure.getStaff(staffNum - 1);
        if (staff.getLayerCount() > 0)
            return staff.getLayer(0);
        return new Layer(staff, 1);
    }

    /**
     * Fill a gap in a layer with spaces. A space spans at most a half note, so long gaps are split up. A gap of up to
     * a quarter is covered by one space of the next longer undotted value, e.g. a dotted eighth gap by a quarter space
     * @param duration length of the gap in divisions
     */
    void fillSpace(Layer layer, int duration) {
        int ppq = session.getPpq() > 0 ? session.getPpq() : 1;
        Fraction perQuarter = Fraction.getFraction(ppq, 1);
        Fraction two = Fraction.getFraction(2, 1);
        Fraction four = Fraction.getFraction(4, 1);
        Fraction remaining = Fraction.getFraction(duration, 1);
        while (remaining.compareTo(Fraction.ZERO) > 0) {
            Fraction quarters = remaining.divideBy(perQuarter);
            if (quarters.compareTo(Fraction.ONE) > 0)
                quarters = Fraction.getFraction(quarters.intValue(), 1);
            if (quarters.compareTo(two) > 0)
                quarters = two;
            //undotted value covering the gap
            int code = Integer.highestOneBit(four.divideBy(quarters).intValue());
            Space space = new Space(stacks.ownerFor(layer));
            space.setDur(converters.durationCode(code));
            remaining = remaining.subtract(quarters.multiplyBy(perQuarter));
        }
    }


    //==========MEASURE CHILDREN====================================================

    private void readAttributes(Element node, Measure measure) {
        //already read as staff definition
        if (session.isConsumed(node))
            return;
        for (Element xmlClef : children(node, "clef")) {
            String numberStr = attribute(xmlClef, "number");
            int staffNum = numberStr.isEmpty() ? 1 : toInt(numberStr);
            Layer layer = selectFirstLayer(staffNum, measure);
            Element sign = child(xmlClef, "sign");
            Element line = child(xmlClef, "line");
            if (sign == null || line == null)
                continue;
            Clef clef = new Clef(stacks.ownerFor(layer));
            clef.setShape(converters.clefShape(content(sign)));
            clef.setLine(toInt(content(line)));
            Element octaveChange = child(xmlClef, "clef-octave-change");
            if (octaveChange != null && !content(octaveChange).isEmpty()) {
                int change = toInt(content(octaveChange));
                if (Math.abs(change) == 1)
                    clef.setDis(OctaveDisplacement.EIGHT);
                else if (Math.abs(change) == 2)
                    clef.setDis(OctaveDisplacement.FIFTEEN);
                clef.setDisPlace(change < 0 ? Place.BELOW : Place.ABOVE);
            }
        }

        Element measureRepeat = nav.select(node, "measure-style/measure-repeat");
        if (measureRepeat != null)
            session.setMeasureRepeat("start".equals(attribute(measureRepeat, "type")));
    }

    private void readBackup(Element node, Measure measure) {
        session.addDuration(-toInt(childContent(node, "duration")));

        Element nextNote = nextSibling(node, "note");
        if (nextNote != null && session.getDurTotal() > 0) {
            //the next note doesn't start at the beginning of the measure
            Layer layer = child(node, "voice") == null ? selectLayer(nextNote, measure) : selectLayer(node, measure);
            fillSpace(layer, session.getDurTotal());
        }
    }

    private void readBarline(Element node, Measure measure, int measureN) {
        Staff staff = measure.getStaff(0);
        String location = attribute(node, "location");

        String barStyle = childContent(node, "bar-style");
        if (!barStyle.isEmpty()) {
            boolean repeat = child(node, "repeat") != null;
            if ("left".equals(location))
                measure.setLeft(converters.barRendition(barStyle, repeat));
            else if ("middle".equals(location))
                diagnostics.warn("Unsupported barline location 'middle'");
            else
                measure.setRight(converters.barRendition(barStyle, repeat));
        }
        if (child(node, "ending") != null)
            diagnostics.warn("Endings not supported");

        Element xmlFermata = child(node, "fermata");
        if (xmlFermata != null) {
            Fermata fermata = createFermata(xmlFermata, measureN);
            if ("left".equals(location))
                fermata.setTstamp(0.0);
            else if ("middle".equals(location))
                diagnostics.warn("Unsupported barline location 'middle'");
            else
                fermata.setTstamp((double) session.getMeterCount() + 1);
            fermata.setStaff(staff.getN());
        }
    }

    private void readDirection(Element node, int measureN) {
        Element type = child(node, "direction-type");
        String placeStr = attribute(node, "placement");
        List<Element> words = children(type, "words");
        boolean soundTempo = nav.exists(node, "sound[@tempo]");

        if (!words.isEmpty() && !soundTempo) {
            Dir dir = new Dir(session.document);
            if (words.size() == 1 && !attribute(words.get(0), "xml:lang").isEmpty())
                dir.setLang(attribute(words.get(0), "xml:lang"));
            dir.setPlace(converters.staffRel(placeStr));
            textRendition(words, dir);
            stacks.addControlElement(measureN, dir);
            stacks.defer(PendingKind.DIR, dir);
        }

        Element xmlDynam = child(type, "dynamics");
        if (xmlDynam != null) {
            Dynam dynam = new Dynam(session.document);
            dynam.setPlace(converters.staffRel(placeStr));
            new Text(dynam, dynamicsText(xmlDynam));
            stacks.addControlElement(measureN, dynam);
            stacks.defer(PendingKind.DYNAM, dynam);
        }

        Element wedge = child(type, "wedge");
        if (wedge != null)
            readWedge(wedge, placeStr, measureN);

        Element xmlShift = child(type, "octave-shift");
        if (xmlShift != null)
            readOctaveShift(node, xmlShift, measureN);

        Element xmlPedal = child(type, "pedal");
        if (xmlPedal != null) {
            Pedal pedal = new Pedal(session.document);
            pedal.setPlace(converters.staffRel(placeStr));
            String pedalType = attribute(xmlPedal, "type");
            pedal.setDir(converters.pedalDirection(pedalType));
            //anchored to the last event until the next event is read
            if ("stop".equals(pedalType))
                pedal.setStartId(session.getLastReference());
            stacks.addControlElement(measureN, pedal);
            stacks.defer(PendingKind.PEDAL, pedal);
        }

        Element metronome = child(type, "metronome");
        if (soundTempo || metronome != null) {
            Tempo tempo = new Tempo(session.document);
            if (words.size() == 1 && !attribute(words.get(0), "xml:lang").isEmpty())
                tempo.setLang(attribute(words.get(0), "xml:lang"));
            tempo.setPlace(converters.staffRel(placeStr));
            textRendition(words, tempo);
            if (metronome != null)
                printMetronome(metronome, tempo);
            else
                tempo.setMidiBpm((int) toDouble(attribute(nav.select(node, "sound[@tempo]"), "tempo")));
            stacks.addControlElement(measureN, tempo);
            stacks.defer(PendingKind.TEMPO, tempo);
        }

        if (words.isEmpty() && xmlDynam == null && metronome == null && xmlShift == null && xmlPedal == null && wedge == null) {
            Element first = firstChildElement(type);
            diagnostics.warn("Unsupported direction-type '{}'", first == null ? "" : first.getNodeName());
        }
    }

    private void readWedge(Element wedge, String placeStr, int measureN) {
        int number = toInt(attribute(wedge, "number"));
        number = number < 1 ? 1 : number;
        if (hasAttributeValue(wedge, "type", "stop")) {
            if (!stacks.closeHairpin(number))
                log.debug("No open hairpin {} to stop", number);
            return;
        }
        Hairpin hairpin = new Hairpin(session.document);
        if (hasAttributeValue(wedge, "type", "crescendo"))
            hairpin.setForm(HairpinForm.CRES);
        else if (hasAttributeValue(wedge, "type", "diminuendo"))
            hairpin.setForm(HairpinForm.DIM);
        setColor(hairpin, wedge);
        hairpin.setPlace(converters.staffRel(placeStr));
        stacks.addControlElement(measureN, hairpin);
        stacks.openHairpin(number, hairpin);
    }

    private void readOctaveShift(Element direction, Element xmlShift, int measureN) {
        String staffStr = childContent(direction, "staff");
        int staffN = session.getStaffOffset() + (staffStr.isEmpty() ? 1 : toInt(staffStr));
        if (hasAttributeValue(xmlShift, "type", "stop")) {
            stacks.stopOctaveShift(staffN, session.getLastReference());
            return;
        }
        Octave octave = new Octave(session.document);
        setColor(octave, xmlShift);
        octave.setStaff(staffN);
        //size defaults to an octave
        String sizeStr = attribute(xmlShift, "size");
        int size = sizeStr.isEmpty() ? 8 : toInt(sizeStr);
        octave.setDis(converters.octaveDisplacement(size));
        int octaves = (size + 2) / 8;
        if (hasAttributeValue(xmlShift, "type", "down")) {
            octave.setDisPlace(Place.BELOW);
            octaves = -octaves;
        }
        else
            octave.setDisPlace(Place.ABOVE);
        stacks.setOctaveDisplacement(staffN, octaves);
        log.debug("Octave shift of {} octaves on staff {}", octaves, staffN);
        stacks.addControlElement(measureN, octave);
        stacks.defer(PendingKind.OCTAVE, octave);
    }

    private void readForward(Element node, Measure measure) {
        int duration = toInt(childContent(node, "duration"));
        session.addDuration(duration);

        Layer layer = selectLayer(node, measure);
        Element nextNote = nextSibling(node, "note");
        if (nextNote != null) {
            if (child(node, "voice") == null)
                layer = selectLayer(nextNote, measure);
            fillSpace(layer, duration);
        }
        else if (previousSibling(node, "note") == null && previousSibling(node, "backup") == null) {
            //nothing in this voice at all, the measure is empty
            MRest mRest = new MRest(stacks.ownerFor(layer));
            mRest.setVisible(false);
        }
    }

    private void readHarmony(Element node, int measureN) {
        StringBuilder harmText = new StringBuilder(childContent(node, "root/root-step"));
        Element alter = nav.select(node, "root/root-alter");
        if (alter != null) {
            switch (content(alter).trim()) {
                case "-1":
                    harmText.append('♭');
                    break;
                case "0":
                    harmText.append('♮');
                    break;
                case "1":
                    harmText.append('♯');
                    break;
                default:
                    break;
            }
        }
        Element kind = child(node, "kind");
        if (kind != null)
            harmText.append(attribute(kind, "text"));
        Harm harm = new Harm(session.document);
        harm.setPlace(converters.staffRel(attribute(node, "placement")));
        if (!attribute(node, "type").isEmpty())
            harm.setType(attribute(node, "type"));
        new Text(harm, harmText.toString());
        stacks.addControlElement(measureN, harm);
        stacks.defer(PendingKind.HARM, harm);
    }


    //==========NOTES====================================================

    private void readNote(Element node, Measure measure, int measureN) {
        Layer layer = selectLayer(node, measure);
        Staff staff = layer.getOwner();
        int staffN = staff.getN();

        if (child(node, "chord") == null)
            session.addDuration(toInt(childContent(node, "duration")));

        //a measure repeat replaces the content of the layer
        if (session.isMeasureRepeat()) {
            if (layer.getFirst(MRpt.class) == null)
                new MRpt(stacks.ownerFor(layer));
            return;
        }

        Element notations = nav.select(node, "notations[not(@print-object='no')]");
        NoteValues values = new NoteValues();
        values.type = childContent(node, "type");
        values.dots = children(node, "dot").size();
        values.cue = child(node, "cue") != null || nav.exists(node, "type[@size='cue']");

        Element tremolo = nav.select(notations, "ornaments/tremolo");
        if (tremolo != null) {
            if (hasAttributeValue(tremolo, "type", "single")) {
                BTrem bTrem = new BTrem(stacks.ownerFor(layer));
                stacks.pushElement(bTrem);
                values.tremSlashNum = toInt(content(tremolo));
            }
            else if (hasAttributeValue(tremolo, "type", "start")) {
                FTrem fTrem = new FTrem(stacks.ownerFor(layer));
                stacks.pushElement(fTrem);
                fTrem.setSlash(toInt(content(tremolo)));
            }
        }

        if (nav.exists(node, "beam[@number='1'][text()='begin']")) {
            Beam beam = new Beam(stacks.ownerFor(layer));
            stacks.pushElement(beam);
        }

        Element tupletStart = nav.select(notations, "tuplet[@type='start']");
        if (tupletStart != null)
            readTupletStart(node, tupletStart, layer);

        LayerElement element;
        Element rest = child(node, "rest");
        if (rest != null)
            element = readRest(node, rest, layer, values);
        else
            element = readPitchedNote(node, notations, layer, values, measureN);

        String reference = element.getReference();
        session.setLastReference(reference);

        readNotations(notations, element, layer, measureN);

        if (tremolo != null) {
            if (hasAttributeValue(tremolo, "type", "single"))
                stacks.removeLastElement(BTrem.class);
            if (hasAttributeValue(tremolo, "type", "stop"))
                stacks.removeLastElement(FTrem.class);
        }
        if (nav.exists(notations, "tuplet[@type='stop']"))
            stacks.removeLastElement(Tuplet.class);
        if (nav.exists(node, "beam[@number='1'][text()='end']"))
            stacks.removeLastElement(Beam.class);

        stacks.anchorPending(staffN, reference);
    }

    private void readTupletStart(Element node, Element tupletStart, Layer layer) {
        Tuplet tuplet = new Tuplet(stacks.ownerFor(layer));
        stacks.pushElement(tuplet);
        Element actualNotes = nav.select(node, "time-modification/actual-notes");
        Element normalNotes = nav.select(node, "time-modification/normal-notes");
        if (actualNotes != null && normalNotes != null) {
            tuplet.setNum(toInt(content(actualNotes)));
            tuplet.setNumBase(toInt(content(normalNotes)));
        }
        String placement = attribute(tupletStart, "placement");
        if (!placement.isEmpty()) {
            tuplet.setNumPlace(converters.staffRel(placement));
            tuplet.setBracketPlace(converters.staffRel(placement));
        }
        String showNumber = attribute(tupletStart, "show-number");
        tuplet.setNumFormat(converters.tupletNumberFormat(showNumber));
        if ("none".equals(showNumber))
            tuplet.setNumVisible(BooleanValue.FALSE);
        tuplet.setBracketVisible(converters.bool(attribute(tupletStart, "bracket")));
    }

    private LayerElement readRest(Element node, Element rest, Layer layer, NoteValues values) {
        String stepStr = childContent(rest, "display-step");
        String octaveStr = childContent(rest, "display-octave");
        if (hasAttributeValue(node, "print-object", "no")) {
            Space space = new Space(stacks.ownerFor(layer));
            space.setDur(converters.duration(values.type));
            return space;
        }
        //a rest without type fills the measure
        if (values.type.isEmpty() || hasAttributeValue(rest, "measure", "yes")) {
            MRest mRest = new MRest(stacks.ownerFor(layer));
            mRest.setCue(values.cue);
            if (!stepStr.isEmpty())
                mRest.setPloc(converters.pitchName(stepStr));
            if (!octaveStr.isEmpty())
                mRest.setOloc(toInt(octaveStr));
            return mRest;
        }
        Rest restElement = new Rest(stacks.ownerFor(layer));
        restElement.setDur(converters.duration(values.type));
        restElement.setDots(values.dots);
        restElement.setCue(values.cue);
        if (!stepStr.isEmpty())
            restElement.setPloc(converters.pitchName(stepStr));
        if (!octaveStr.isEmpty())
            restElement.setOloc(toInt(octaveStr));
        return restElement;
    }

    /**
     * Read a pitched note. If the note starts a chord, the chord is created and returned instead of the note
     */
    private StemmedElement readPitchedNote(Element node, @Nullable Element notations, Layer layer, NoteValues values, int measureN) {
        int staffN = layer.getOwner().getN();

        StemDirection stemDir = StemDirection.NONE;
        String stemDirStr = childContent(node, "stem");
        if ("down".equals(stemDirStr))
            stemDir = StemDirection.DOWN;
        else if ("up".equals(stemDirStr))
            stemDir = StemDirection.UP;

        //the next note tells whether a chord starts or ends here
        Element nextNote = nextSibling(node, "note");
        boolean nextIsChord = nextNote != null && child(nextNote, "chord") != null;
        StemmedElement element = null;
        if (nextIsChord && !(stacks.topElement() instanceof Chord)) {
            Chord chord = new Chord(stacks.ownerFor(layer));
            values.applyTo(chord, stemDir, converters);
            stacks.pushElement(chord);
            element = chord;
        }

        Note note = new Note(stacks.ownerFor(layer));
        if (element == null)
            element = note;
        note.setVisible(converters.bool(attribute(node, "print-object")) != BooleanValue.FALSE);
        if (!attribute(node, "color").isEmpty())
            note.setColor(attribute(node, "color"));

        Element accidental = child(node, "accidental");
        if (accidental != null) {
            Accid accid = new Accid(note);
            accid.setAccid(converters.accidental(content(accidental)));
            if (!attribute(accidental, "color").isEmpty())
                accid.setColor(attribute(accidental, "color"));
            if (hasAttributeValue(accidental, "cautionary", "yes"))
                accid.setFunc(AccidentalFunction.CAUTION);
            if (hasAttributeValue(accidental, "editorial", "yes"))
                accid.setFunc(AccidentalFunction.EDIT);
            if (hasAttributeValue(accidental, "bracket", "yes"))
                accid.setEnclose(Enclosure.BRACKET);
            if (hasAttributeValue(accidental, "parentheses", "yes"))
                accid.setEnclose(Enclosure.PAREN);
        }

        Element pitch = child(node, "pitch");
        if (pitch != null) {
            String stepStr = childContent(pitch, "step");
            if (!stepStr.isEmpty())
                note.setPname(converters.pitchName(stepStr));
            String octaveStr = childContent(pitch, "octave");
            if (!octaveStr.isEmpty()) {
                int octave = toInt(octaveStr);
                int displacement = stacks.getOctaveDisplacement(staffN);
                if (displacement != 0) {
                    note.setOct(octave + displacement);
                    note.setOctGes(octave);
                }
                else
                    note.setOct(octave);
            }
            String alterStr = childContent(pitch, "alter");
            if (accidental == null && !alterStr.isEmpty()) {
                Accid accid = note.getAccid() != null ? note.getAccid() : new Accid(note);
                accid.setAccidGes(converters.alteration(toDouble(alterStr)));
            }
        }

        Element grace = child(node, "grace");
        if (grace != null) {
            String slashStr = attribute(grace, "slash");
            if ("no".equals(slashStr))
                note.setGrace(Grace.ACC);
            else if ("yes".equals(slashStr)) {
                note.setGrace(Grace.UNACC);
                note.setStemMod(StemModifier.SLASH_1);
            }
            else
                note.setGrace(Grace.UNKNOWN);
        }

        //inside a chord, duration and stem belong to the chord
        if (!(stacks.topElement() instanceof Chord))
            values.applyTo(note, stemDir, converters);

        readLyrics(node, note);
        readTies(notations, note, layer, measureN);
        readArticulations(notations, element);

        if (!nextIsChord && stacks.topElement() instanceof Chord)
            stacks.removeLastElement(Chord.class);
        return element;
    }

    private void readLyrics(Element node, Note note) {
        for (Element lyric : children(node, "lyric")) {
            int lyricNumber = toInt(attribute(lyric, "number"));
            Verse verse = new Verse(note, lyricNumber < 1 ? 1 : lyricNumber);
            if (!attribute(lyric, "color").isEmpty())
                verse.setColor(attribute(lyric, "color"));
            if ("no".equals(attribute(lyric, "print-object")))
                continue;
            String syllabic = childContent(lyric, "syllabic");
            for (Element textNode : children(lyric, "text")) {
                Syl syl = new Syl(verse);
                if (!attribute(textNode, "xml:lang").isEmpty())
                    syl.setLang(attribute(textNode, "xml:lang"));
                if (child(lyric, "extend") != null)
                    syl.setCon(SylConnector.U);
                if (nextSibling(textNode, "elision") != null)
                    syl.setCon(SylConnector.B);
                if ("begin".equals(syllabic)) {
                    syl.setCon(SylConnector.D);
                    syl.setWordPos(WordPosition.I);
                }
                else if ("middle".equals(syllabic)) {
                    syl.setCon(SylConnector.D);
                    syl.setWordPos(WordPosition.M);
                }
                else if ("end".equals(syllabic))
                    syl.setWordPos(WordPosition.T);
                syl.setFontStyle(converters.fontStyle(attribute(textNode, "font-style")));
                syl.setFontWeight(converters.fontWeight(attribute(textNode, "font-weight")));
                new Text(syl, content(textNode));
            }
        }
    }

    private void readTies(@Nullable Element notations, Note note, Layer layer, int measureN) {
        int staffN = layer.getOwner().getN();
        Element startTie = nav.select(notations, "tied[@type='start']");
        Element endTie = nav.select(notations, "tied[@type='stop']");
        stacks.closeTie(staffN, layer.getN(), note, endTie != null);
        if (startTie != null) {
            Tie tie = new Tie(session.document);
            setColor(tie, startTie);
            tie.setCurveDir(converters.orientation(attribute(startTie, "orientation")));
            if (!attribute(startTie, "placement").isEmpty())
                tie.setCurveDir(converters.curveDirection(attribute(startTie, "placement")));
            stacks.addControlElement(measureN, tie);
            stacks.openTie(staffN, layer.getN(), note, tie);
        }
    }

    private void readArticulations(@Nullable Element notations, StemmedElement element) {
        for (Element articulations : children(notations, "articulations")) {
            Artic artic = new Artic(element);
            addIfPresent(artic, articulations, "accent", Articulation.ACC);
            addIfPresent(artic, articulations, "detached-legato", Articulation.TEN_STACC);
            addIfPresent(artic, articulations, "spiccato", Articulation.SPICC);
            addIfPresent(artic, articulations, "staccatissimo", Articulation.STACCISS);
            addIfPresent(artic, articulations, "staccato", Articulation.STACC);
            addIfPresent(artic, articulations, "strong-accent", Articulation.MARC);
            addIfPresent(artic, articulations, "tenuto", Articulation.TEN);
        }
        for (Element technical : children(notations, "technical")) {
            Artic artic = new Artic(element);
            addIfPresent(artic, technical, "down-bow", Articulation.DNBOW);
            addIfPresent(artic, technical, "harmonic", Articulation.HARM);
            addIfPresent(artic, technical, "open-string", Articulation.OPEN);
            addIfPresent(artic, technical, "snap-pizzicato", Articulation.SNAP);
            addIfPresent(artic, technical, "stopped", Articulation.STOP);
            addIfPresent(artic, technical, "up-bow", Articulation.UPBOW);
            artic.setType("technical");
        }
    }

    private static void addIfPresent(Artic artic, Element group, String name, Articulation articulation) {
        if (child(group, name) != null)
            artic.addArtic(articulation);
    }

    /**
     * Read dynamics, fermatas, ornaments and slurs of an event. All are anchored to the event just read
     */
    private void readNotations(@Nullable Element notations, LayerElement element, Layer layer, int measureN) {
        if (notations == null)
            return;
        int staffN = layer.getOwner().getN();
        String reference = session.getLastReference();

        Element xmlDynam = child(notations, "dynamics");
        if (xmlDynam != null) {
            Dynam dynam = new Dynam(session.document);
            stacks.addControlElement(measureN, dynam);
            anchor(dynam, staffN, reference);
            dynam.setPlace(converters.staffRel(attribute(xmlDynam, "placement")));
            new Text(dynam, dynamicsText(xmlDynam));
        }

        Element xmlFermata = child(notations, "fermata");
        if (xmlFermata != null)
            anchor(createFermata(xmlFermata, measureN), staffN, reference);

        Element mordent = nav.select(notations, "ornaments/mordent");
        if (mordent != null)
            createMordent(mordent, OrnamentForm.NORM, staffN, measureN);
        Element invertedMordent = nav.select(notations, "ornaments/inverted-mordent");
        if (invertedMordent != null)
            createMordent(invertedMordent, OrnamentForm.INV, staffN, measureN);

        Element xmlTrill = nav.select(notations, "ornaments/trill-mark");
        if (xmlTrill != null) {
            Trill trill = new Trill(session.document);
            stacks.addControlElement(measureN, trill);
            anchor(trill, staffN, reference);
            setColor(trill, xmlTrill);
            trill.setPlace(converters.staffRel(attribute(xmlTrill, "placement")));
        }

        Element turn = nav.select(notations, "ornaments/turn");
        if (turn != null)
            createTurn(turn, OrnamentForm.NORM, staffN, measureN);
        Element invertedTurn = nav.select(notations, "ornaments/inverted-turn");
        if (invertedTurn != null)
            createTurn(invertedTurn, OrnamentForm.INV, staffN, measureN);

        //slurs across staves are matched on the staff they start on only
        for (Element xmlSlur : children(notations, "slur")) {
            int number = toInt(attribute(xmlSlur, "number"));
            number = number < 1 ? 1 : number;
            if (hasAttributeValue(xmlSlur, "type", "start")) {
                Slur slur = new Slur(session.document);
                setColor(slur, xmlSlur);
                slur.setCurveDir(converters.orientation(attribute(xmlSlur, "orientation")));
                if (!attribute(xmlSlur, "placement").isEmpty())
                    slur.setCurveDir(converters.curveDirection(attribute(xmlSlur, "placement")));
                stacks.addControlElement(measureN, slur);
                stacks.openSlur(staffN, layer.getN(), number, slur, reference);
            }
            else if (hasAttributeValue(xmlSlur, "type", "stop"))
                stacks.closeSlur(staffN, layer.getN(), number, element);
        }
    }

    private void createMordent(Element xmlMordent, OrnamentForm form, int staffN, int measureN) {
        Mordent mordent = new Mordent(session.document);
        stacks.addControlElement(measureN, mordent);
        anchor(mordent, staffN, session.getLastReference());
        setColor(mordent, xmlMordent);
        mordent.setForm(form);
        if (!attribute(xmlMordent, "long").isEmpty())
            mordent.setLong(converters.bool(attribute(xmlMordent, "long")) == BooleanValue.TRUE);
        mordent.setPlace(converters.staffRel(attribute(xmlMordent, "placement")));
    }

    private void createTurn(Element xmlTurn, OrnamentForm form, int staffN, int measureN) {
        Turn turn = new Turn(session.document);
        stacks.addControlElement(measureN, turn);
        anchor(turn, staffN, session.getLastReference());
        setColor(turn, xmlTurn);
        turn.setForm(form);
        turn.setPlace(converters.staffRel(attribute(xmlTurn, "placement")));
    }

    /**
     * Create a fermata from a fermata element of a note or a barline. Staff and anchor are left to the caller
     */
    private Fermata createFermata(Element xmlFermata, int measureN) {
        Fermata fermata = new Fermata(session.document);
        stacks.addControlElement(measureN, fermata);
        setColor(fermata, xmlFermata);
        fermata.setShape(converters.fermataShape(content(xmlFermata)));
        if (hasAttributeValue(xmlFermata, "type", "inverted")) {
            fermata.setForm(FermataForm.INV);
            fermata.setPlace(StaffRel.BELOW);
        }
        else if (hasAttributeValue(xmlFermata, "type", "upright")) {
            fermata.setForm(FermataForm.NORM);
            fermata.setPlace(StaffRel.ABOVE);
        }
        return fermata;
    }


    //==========TEXT====================================================

    /**
     * Add the text of words elements to the owner. Words with formatting of their own get wrapped in a {@link Rend}
     */
    private void textRendition(List<Element> words, TextOwner owner) {
        for (Element textNode : words) {
            String textAlign = attribute(textNode, "halign");
            String textColor = attribute(textNode, "color");
            String textFont = attribute(textNode, "font-family");
            String textStyle = attribute(textNode, "font-style");
            String textWeight = attribute(textNode, "font-weight");
            String lang = attribute(textNode, "xml:lang");
            if (textColor.isEmpty() && textFont.isEmpty() && textStyle.isEmpty() && textWeight.isEmpty()) {
                new Text(owner, content(textNode));
                continue;
            }
            Rend rend = new Rend(owner);
            //a single language is set on the owner instead
            if (words.size() > 1 && !lang.isEmpty())
                rend.setLang(lang);
            rend.setHalign(converters.horizontalAlignment(textAlign));
            if (!textColor.isEmpty())
                rend.setColor(textColor);
            if (!textFont.isEmpty())
                rend.setFontFamily(textFont);
            rend.setFontStyle(converters.fontStyle(textStyle));
            rend.setFontWeight(converters.fontWeight(textWeight));
            new Text(rend, content(textNode));
        }
    }

    private void printMetronome(Element metronome, Tempo tempo) {
        StringBuilder tempoText = new StringBuilder("M.M.");
        Element perMinute = child(metronome, "per-minute");
        if (perMinute != null) {
            String mm = content(perMinute).trim();
            if (toInt(mm) != 0)
                tempo.setMm(toInt(mm));
            tempoText.append(" = ").append(mm);
        }
        Element beatUnit = child(metronome, "beat-unit");
        if (beatUnit != null)
            tempo.setMmUnit(converters.duration(content(beatUnit)));
        tempo.setMmDots(children(metronome, "beat-unit-dot").size());
        if ("yes".equals(attribute(metronome, "parentheses")))
            tempoText.insert(0, '(').append(')');
        new Text(tempo, tempoText.toString());
    }

    /**
     * @return the text of other-dynamics, or the name of the first marking like "p" or "sfz"
     */
    private static String dynamicsText(Element xmlDynam) {
        String dynamStr = childContent(xmlDynam, "other-dynamics");
        if (dynamStr.isEmpty()) {
            Element first = firstChildElement(xmlDynam);
            dynamStr = first == null ? "" : first.getNodeName();
        }
        return dynamStr;
    }

    private static void anchor(ControlElement element, int staffN, String reference) {
        element.setStaff(staffN);
        element.setStartId(reference);
    }

    private static void setColor(ControlElement element, Element node) {
        if (!attribute(node, "color").isEmpty())
            element.setColor(attribute(node, "color"));
    }


    /**
     * Duration related values of a note element, shared by the note and the chord it starts
     */
    private static final class NoteValues {
        String type;
        int dots;
        boolean cue;
        int tremSlashNum;

        void applyTo(StemmedElement element, StemDirection stemDir, MusicXmlConverters converters) {
            element.setDur(converters.duration(type));
            element.setDots(dots);
            element.setStemDir(stemDir);
            element.setCue(cue);
            if (tremSlashNum > 0)
                element.setStemMod(converters.stemModifier(tremSlashNum));
        }
    }
}
