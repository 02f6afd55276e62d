package net.scoreworks.musicxml;

import net.scoreworks.musicxml.CrossReferenceStacks.PendingKind;
import net.scoreworks.scoretree.model.Beam;
import net.scoreworks.scoretree.model.Dir;
import net.scoreworks.scoretree.model.Hairpin;
import net.scoreworks.scoretree.model.Layer;
import net.scoreworks.scoretree.model.Measure;
import net.scoreworks.scoretree.model.Note;
import net.scoreworks.scoretree.model.Octave;
import net.scoreworks.scoretree.model.ScoreDocument;
import net.scoreworks.scoretree.model.Section;
import net.scoreworks.scoretree.model.Slur;
import net.scoreworks.scoretree.model.Staff;
import net.scoreworks.scoretree.model.Tie;
import net.scoreworks.scoretree.model.Tuplet;
import net.scoreworks.scoretree.model.data.PitchName;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CrossReferenceStacksTests {
    ImportDiagnostics diagnostics;
    CrossReferenceStacks stacks;
    ScoreDocument document;
    Layer layer;

    @BeforeEach
    public void prepareLayer() {
        diagnostics = new ImportDiagnostics();
        stacks = new CrossReferenceStacks(diagnostics);
        document = new ScoreDocument();
        Measure measure = new Measure(new Section(document), 1);
        layer = new Layer(new Staff(measure, 1), 1);
    }

    private Note createNote(PitchName pname, int oct) {
        Note note = new Note(stacks.ownerFor(layer));
        note.setPname(pname);
        note.setOct(oct);
        return note;
    }

    @Test
    public void testOpenElements() {
        Assertions.assertSame(layer, stacks.ownerFor(layer));
        Beam beam = new Beam(stacks.ownerFor(layer));
        stacks.pushElement(beam);
        Tuplet tuplet = new Tuplet(stacks.ownerFor(layer));
        stacks.pushElement(tuplet);
        Note note = createNote(PitchName.C, 4);
        Assertions.assertSame(tuplet, note.getOwner());
        Assertions.assertSame(layer, note.getLayer());

        //the beam ends inside the tuplet
        stacks.removeLastElement(Beam.class);
        Assertions.assertSame(tuplet, stacks.topElement());
        Assertions.assertEquals(1, stacks.getOpenElementCount());
        stacks.clearElements();
        Assertions.assertFalse(stacks.hasOpenElements());
    }

    @Test
    public void testTieIsClosedBySamePitch() {
        Note start = createNote(PitchName.C, 4);
        Tie tie = new Tie(document);
        stacks.openTie(1, 1, start, tie);
        Assertions.assertEquals(start.getReference(), tie.getStartId());

        stacks.closeTie(1, 1, createNote(PitchName.D, 4), false);
        stacks.closeTie(2, 1, createNote(PitchName.C, 4), true);
        Assertions.assertEquals(1, stacks.getOpenTieCount());

        Note end = createNote(PitchName.C, 4);
        stacks.closeTie(1, 1, end, true);
        Assertions.assertEquals(end.getReference(), tie.getEndId());
        Assertions.assertEquals(0, stacks.getOpenTieCount());
        Assertions.assertFalse(diagnostics.hasWarnings());
    }

    @Test
    public void testTieWithoutStopIsClosedWithWarning() {
        Tie tie = new Tie(document);
        stacks.openTie(1, 1, createNote(PitchName.E, 5), tie);
        Note end = createNote(PitchName.E, 5);
        stacks.closeTie(1, 1, end, false);
        Assertions.assertEquals(end.getReference(), tie.getEndId());
        Assertions.assertTrue(diagnostics.getWarnings().get(0).contains("tie stop is missing"));
    }

    @Test
    public void testSlursAreMatchedByNumber() {
        Slur first = new Slur(document);
        Slur second = new Slur(document);
        stacks.openSlur(1, 1, 1, first, "#a");
        stacks.openSlur(1, 1, 2, second, "#b");

        Note end = createNote(PitchName.G, 4);
        stacks.closeSlur(1, 1, 2, end);
        Assertions.assertEquals(end.getReference(), second.getEndId());
        Assertions.assertNull(first.getEndId());
        Assertions.assertEquals(1, stacks.getOpenSlurCount());

        stacks.closeSlur(1, 2, 1, end);
        Assertions.assertEquals(1, diagnostics.getWarnings().size());
        Assertions.assertEquals(1, stacks.getOpenSlurCount());
    }

    @Test
    public void testHairpinEndsAtLastAnchor() {
        Assertions.assertFalse(stacks.closeHairpin(3));
        Hairpin hairpin = new Hairpin(document);
        stacks.openHairpin(1, hairpin);
        stacks.anchorPending(2, "#a");
        stacks.anchorPending(2, "#b");
        Assertions.assertEquals("#a", hairpin.getStartId());
        Assertions.assertEquals(List.of(2), hairpin.getStaff());

        Assertions.assertTrue(stacks.closeHairpin(1));
        Assertions.assertEquals("#b", hairpin.getEndId());
        Assertions.assertEquals(0, stacks.getOpenHairpinCount());
        //anchoring after the stop doesn't move the end
        stacks.anchorPending(2, "#c");
        Assertions.assertEquals("#b", hairpin.getEndId());
    }

    @Test
    public void testPendingElementsAreAnchoredOnce() {
        Dir dir = new Dir(document);
        stacks.defer(PendingKind.DIR, dir);
        Assertions.assertEquals(1, stacks.getPendingCount(PendingKind.DIR));
        stacks.anchorPending(3, "#x");
        Assertions.assertEquals("#x", dir.getStartId());
        Assertions.assertEquals(List.of(3), dir.getStaff());
        Assertions.assertEquals(0, stacks.getPendingCount(PendingKind.DIR));
        stacks.anchorPending(4, "#y");
        Assertions.assertEquals("#x", dir.getStartId());
    }

    @Test
    public void testOctaveShiftPerStaff() {
        Assertions.assertEquals(0, stacks.getOctaveDisplacement(5));
        stacks.setOctaveDisplacement(5, -1);
        Octave octave = new Octave(document);
        octave.setStaff(5);
        stacks.addControlElement(1, octave);
        Octave other = new Octave(document);
        other.setStaff(6);
        stacks.addControlElement(1, other);

        stacks.stopOctaveShift(5, "#e");
        Assertions.assertEquals(0, stacks.getOctaveDisplacement(5));
        Assertions.assertEquals("#e", octave.getEndId());
        Assertions.assertNull(other.getEndId());
        Assertions.assertEquals(2, stacks.getControlElements().size());
    }

    @Test
    public void testReportUnclosed() {
        stacks.openTie(1, 1, createNote(PitchName.A, 3), new Tie(document));
        stacks.openSlur(1, 1, 1, new Slur(document), "#s");
        stacks.openHairpin(1, new Hairpin(document));
        stacks.reportUnclosed();
        Assertions.assertEquals(3, diagnostics.getWarnings().size());
    }
}
