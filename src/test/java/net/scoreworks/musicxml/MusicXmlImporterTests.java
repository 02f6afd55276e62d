package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.Accid;
import net.scoreworks.scoretree.model.Beam;
import net.scoreworks.scoretree.model.Chord;
import net.scoreworks.scoretree.model.Clef;
import net.scoreworks.scoretree.model.ControlElement;
import net.scoreworks.scoretree.model.Dir;
import net.scoreworks.scoretree.model.Dynam;
import net.scoreworks.scoretree.model.Fermata;
import net.scoreworks.scoretree.model.Hairpin;
import net.scoreworks.scoretree.model.Harm;
import net.scoreworks.scoretree.model.Layer;
import net.scoreworks.scoretree.model.LayerElement;
import net.scoreworks.scoretree.model.MRest;
import net.scoreworks.scoretree.model.Measure;
import net.scoreworks.scoretree.model.Note;
import net.scoreworks.scoretree.model.Octave;
import net.scoreworks.scoretree.model.Rend;
import net.scoreworks.scoretree.model.Rest;
import net.scoreworks.scoretree.model.ScoreDocument;
import net.scoreworks.scoretree.model.Section;
import net.scoreworks.scoretree.model.Slur;
import net.scoreworks.scoretree.model.Space;
import net.scoreworks.scoretree.model.Staff;
import net.scoreworks.scoretree.model.StaffDef;
import net.scoreworks.scoretree.model.StaffGrp;
import net.scoreworks.scoretree.model.Syl;
import net.scoreworks.scoretree.model.Tempo;
import net.scoreworks.scoretree.model.Tie;
import net.scoreworks.scoretree.model.Tuplet;
import net.scoreworks.scoretree.model.data.AccidentalExplicit;
import net.scoreworks.scoretree.model.data.AccidentalImplicit;
import net.scoreworks.scoretree.model.data.Articulation;
import net.scoreworks.scoretree.model.data.BarRendition;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.CurveDirection;
import net.scoreworks.scoretree.model.data.Duration;
import net.scoreworks.scoretree.model.data.FermataForm;
import net.scoreworks.scoretree.model.data.FermataShape;
import net.scoreworks.scoretree.model.data.FontStyle;
import net.scoreworks.scoretree.model.data.HairpinForm;
import net.scoreworks.scoretree.model.data.KeyMode;
import net.scoreworks.scoretree.model.data.KeySignature;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.PitchName;
import net.scoreworks.scoretree.model.data.Place;
import net.scoreworks.scoretree.model.data.StaffGroupSymbol;
import net.scoreworks.scoretree.model.data.StaffRel;
import net.scoreworks.scoretree.model.data.StemDirection;
import net.scoreworks.scoretree.model.data.SylConnector;
import net.scoreworks.scoretree.model.data.TupletNumberFormat;
import net.scoreworks.scoretree.model.data.WordPosition;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class MusicXmlImporterTests {
    MusicXmlImporter importer = new MusicXmlImporter();

    private ImportResult importResource(String name) {
        try {
            Path path = Paths.get(MusicXmlImporterTests.class.getResource("/musicxml/" + name).toURI());
            return importer.importFile(path);
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<LayerElement> elementsOf(ScoreDocument document, int measureIdx, int staffN, int layerN) {
        Measure measure = document.getSection(0).getMeasure(measureIdx);
        Staff staff = measure.findStaff(staffN);
        Assertions.assertNotNull(staff);
        Layer layer = staff.findLayer(layerN);
        Assertions.assertNotNull(layer);
        return layer.getElements();
    }

    private static boolean containsWarning(ImportResult result, String part) {
        for (String warning : result.getWarnings()) {
            if (warning.contains(part))
                return true;
        }
        return false;
    }

    @Test
    public void testStaffDefinitionsOfTwoParts() {
        ImportResult result = importResource("two_parts.musicxml");
        ScoreDocument document = result.getDocument();
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());
        Assertions.assertEquals(96, document.getScoreDef().getMidiBpm());

        StaffGrp root = (StaffGrp) document.getScoreDef().getMembers().get(0);
        Assertions.assertEquals(2, root.getMembers().size());

        //the part-group holds the single staff of the flute
        StaffGrp bracket = (StaffGrp) root.getMembers().get(0);
        Assertions.assertEquals(StaffGroupSymbol.BRACKET, bracket.getSymbol());
        Assertions.assertEquals(1, bracket.getMembers().size());
        StaffDef flute = (StaffDef) bracket.getMembers().get(0);
        Assertions.assertEquals(1, flute.getN());
        Assertions.assertEquals("Flute", flute.getLabel());
        Assertions.assertEquals("Fl.", flute.getLabelAbbr());
        Assertions.assertEquals(KeySignature.ofFifths(-2), flute.getKeySig());
        Assertions.assertEquals(KeyMode.MAJOR, flute.getKeyMode());
        Assertions.assertEquals(3, flute.getMeterCount());
        Assertions.assertEquals(4, flute.getMeterUnit());
        Assertions.assertEquals(ClefShape.G, flute.getClefShape());
        Assertions.assertEquals(2, flute.getClefLine());

        //the piano gets a braced group of its own
        StaffGrp piano = (StaffGrp) root.getMembers().get(1);
        Assertions.assertEquals(StaffGroupSymbol.BRACE, piano.getSymbol());
        Assertions.assertEquals(BooleanValue.TRUE, piano.getBarThru());
        Assertions.assertEquals("Piano", piano.getLabel());
        Assertions.assertEquals("Pno.", piano.getLabelAbbr());
        Assertions.assertEquals(2, piano.getMembers().size());
        StaffDef upper = (StaffDef) piano.getMembers().get(0);
        StaffDef lower = (StaffDef) piano.getMembers().get(1);
        Assertions.assertEquals(2, upper.getN());
        Assertions.assertEquals(3, lower.getN());
        Assertions.assertEquals(ClefShape.F, lower.getClefShape());
        Assertions.assertEquals(4, lower.getClefLine());
        Assertions.assertNull(upper.getLabel());
    }

    @Test
    public void testOneWholeNotePerStaff() {
        ImportResult result = importResource("whole_notes.musicxml");
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());
        Section section = result.getDocument().getSection(0);
        Assertions.assertEquals(1, section.getMeasureCount());
        Measure measure = section.getMeasure(0);
        Assertions.assertEquals(3, measure.getStaffCount());
        for (int i = 0; i < 3; i++) {
            Staff staff = measure.getStaff(i);
            Assertions.assertEquals(i + 1, staff.getN());
            Assertions.assertEquals(1, staff.getLayerCount());
            List<LayerElement> elements = staff.getLayer(0).getElements();
            Assertions.assertEquals(1, elements.size());
            Assertions.assertTrue(elements.get(0) instanceof Note);
            Assertions.assertEquals(Duration.WHOLE, ((Note) elements.get(0)).getDur());
        }
    }

    @Test
    public void testMeasuresOfPartsAreMerged() {
        ScoreDocument document = importResource("two_parts.musicxml").getDocument();
        Section section = document.getSection(0);
        Assertions.assertEquals(2, section.getMeasureCount());
        for (Measure measure : section.getMeasures()) {
            Assertions.assertEquals(3, measure.getStaffCount());
            //staff numbers are contiguous over all parts
            for (int i = 0; i < measure.getStaffCount(); i++) {
                Assertions.assertEquals(i + 1, measure.getStaff(i).getN());
            }
        }
        Assertions.assertEquals(1, section.getMeasure(0).getN());
        Assertions.assertEquals(2, section.getMeasure(1).getN());

        Note flute = (Note) elementsOf(document, 0, 1, 1).get(0);
        Assertions.assertEquals(PitchName.C, flute.getPname());
        Assertions.assertEquals(5, flute.getOct());
        Assertions.assertEquals(Duration.HALF, flute.getDur());
        Assertions.assertEquals(1, flute.getDots());

        Note bass = (Note) elementsOf(document, 0, 3, 5).get(0);
        Assertions.assertEquals(PitchName.C, bass.getPname());
        Assertions.assertEquals(3, bass.getOct());

        Assertions.assertTrue(elementsOf(document, 1, 1, 1).get(0) instanceof MRest);
        Assertions.assertSame(document, bass.getRootEntity());
    }

    @Test
    public void testTiesAndSlurs() {
        ImportResult result = importResource("ties_and_slurs.musicxml");
        ScoreDocument document = result.getDocument();
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());

        List<LayerElement> first = elementsOf(document, 0, 1, 1);
        Note start = (Note) first.get(1);
        Note end = (Note) elementsOf(document, 1, 1, 1).get(0);

        List<Tie> ties = document.getSection(0).getMeasure(0).getControlElements(Tie.class);
        Assertions.assertEquals(1, ties.size());
        Tie tie = ties.get(0);
        Assertions.assertEquals(start.getReference(), tie.getStartId());
        Assertions.assertEquals(end.getReference(), tie.getEndId());
        Assertions.assertEquals(CurveDirection.BELOW, tie.getCurveDir());

        List<Slur> slurs = document.getSection(0).getMeasure(0).getControlElements(Slur.class);
        Assertions.assertEquals(1, slurs.size());
        Slur slur = slurs.get(0);
        Assertions.assertEquals(first.get(0).getReference(), slur.getStartId());
        Assertions.assertEquals(start.getReference(), slur.getEndId());
        Assertions.assertEquals(CurveDirection.ABOVE, slur.getCurveDir());
        //anchors resolve to objects of the document
        Assertions.assertSame(start, document.findById(tie.getStartId()));
        Assertions.assertSame(end, document.findById(tie.getEndId()));
    }

    @Test
    public void testHairpinsAreMatchedByNumber() {
        ScoreDocument document = importResource("hairpins.musicxml").getDocument();
        List<LayerElement> notes = elementsOf(document, 0, 1, 1);
        List<Hairpin> hairpins = document.getSection(0).getMeasure(0).getControlElements(Hairpin.class);
        Assertions.assertEquals(2, hairpins.size());

        Hairpin crescendo = hairpins.get(0);
        Assertions.assertEquals(HairpinForm.CRES, crescendo.getForm());
        Assertions.assertEquals(StaffRel.BELOW, crescendo.getPlace());
        Assertions.assertEquals(List.of(1), crescendo.getStaff());
        Assertions.assertEquals(notes.get(0).getReference(), crescendo.getStartId());
        Assertions.assertEquals(notes.get(1).getReference(), crescendo.getEndId());

        Hairpin diminuendo = hairpins.get(1);
        Assertions.assertEquals(HairpinForm.DIM, diminuendo.getForm());
        Assertions.assertEquals(notes.get(1).getReference(), diminuendo.getStartId());
        Assertions.assertEquals(notes.get(2).getReference(), diminuendo.getEndId());
    }

    @Test
    public void testHairpinStopClosesOnlyOneOfTwoStaves() {
        ImportResult result = importResource("hairpins_two_staves.musicxml");
        ScoreDocument document = result.getDocument();
        Note upper = (Note) elementsOf(document, 0, 1, 1).get(0);
        Note lower = (Note) elementsOf(document, 0, 2, 5).get(0);

        List<Hairpin> hairpins = document.getSection(0).getMeasure(0).getControlElements(Hairpin.class);
        Assertions.assertEquals(2, hairpins.size());
        Hairpin crescendo = hairpins.get(0);
        Assertions.assertEquals(HairpinForm.CRES, crescendo.getForm());
        Assertions.assertEquals(List.of(1), crescendo.getStaff());
        Assertions.assertEquals(upper.getReference(), crescendo.getStartId());
        //ends at the last note read before the stop
        Assertions.assertEquals(lower.getReference(), crescendo.getEndId());

        Hairpin diminuendo = hairpins.get(1);
        Assertions.assertEquals(HairpinForm.DIM, diminuendo.getForm());
        Assertions.assertEquals(List.of(2), diminuendo.getStaff());
        Assertions.assertEquals(lower.getReference(), diminuendo.getStartId());
        Assertions.assertNull(diminuendo.getEndId());

        Assertions.assertEquals(1, result.getWarnings().size(), result.getWarnings().toString());
        Assertions.assertTrue(containsWarning(result, "Hairpin 1 starting at '" + lower.getReference() + "' was never closed"));
    }

    @Test
    public void testOctaveShiftIsScopedToItsStaff() {
        ImportResult result = importResource("octave_shift.musicxml");
        ScoreDocument document = result.getDocument();
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());

        Note upper = (Note) elementsOf(document, 0, 1, 1).get(0);
        Assertions.assertEquals(5, upper.getOct());
        Assertions.assertNull(upper.getOctGes());

        Note shifted = (Note) elementsOf(document, 0, 2, 2).get(0);
        Assertions.assertEquals(2, shifted.getOct());
        Assertions.assertEquals(3, shifted.getOctGes());

        //the shift ends with the first measure
        Note unshifted = (Note) elementsOf(document, 1, 2, 2).get(0);
        Assertions.assertEquals(3, unshifted.getOct());
        Assertions.assertNull(unshifted.getOctGes());

        List<Octave> octaves = document.getSection(0).getMeasure(0).getControlElements(Octave.class);
        Assertions.assertEquals(1, octaves.size());
        Octave octave = octaves.get(0);
        Assertions.assertEquals(List.of(2), octave.getStaff());
        Assertions.assertEquals(OctaveDisplacement.EIGHT, octave.getDis());
        Assertions.assertEquals(Place.BELOW, octave.getDisPlace());
        Assertions.assertEquals(shifted.getReference(), octave.getStartId());
        Assertions.assertEquals(shifted.getReference(), octave.getEndId());
    }

    @Test
    public void testGapsAreFilled() {
        ImportResult result = importResource("gaps.musicxml");
        ScoreDocument document = result.getDocument();
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());

        //a measure with nothing but a forward is an invisible measure rest
        List<LayerElement> empty = elementsOf(document, 0, 1, 1);
        Assertions.assertEquals(1, empty.size());
        MRest mRest = (MRest) empty.get(0);
        Assertions.assertFalse(mRest.isVisible());

        //the second voice starts after a half note
        List<LayerElement> secondVoice = elementsOf(document, 1, 1, 2);
        Assertions.assertEquals(2, secondVoice.size());
        Assertions.assertEquals(Duration.HALF, ((Space) secondVoice.get(0)).getDur());
        Assertions.assertEquals(PitchName.B, ((Note) secondVoice.get(1)).getPname());

        List<LayerElement> forward = elementsOf(document, 2, 1, 1);
        Assertions.assertEquals(3, forward.size());
        Assertions.assertTrue(forward.get(0) instanceof Note);
        Assertions.assertEquals(Duration.HALF, ((Space) forward.get(1)).getDur());
        Assertions.assertTrue(forward.get(2) instanceof Note);
    }

    @Test
    public void testNotesAndContainers() {
        ImportResult result = importResource("notes.musicxml");
        ScoreDocument document = result.getDocument();
        Assertions.assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());

        List<LayerElement> elements = elementsOf(document, 0, 1, 1);
        Assertions.assertEquals(3, elements.size());

        Note quarterSharp = (Note) elements.get(0);
        Accid accid = quarterSharp.getAccid();
        Assertions.assertNotNull(accid);
        Assertions.assertEquals(AccidentalImplicit.QUARTER_SHARP, accid.getAccidGes());
        Assertions.assertEquals(AccidentalExplicit.NONE, accid.getAccid());
        Syl syl = quarterSharp.getVerses().get(0).getSyls().get(0);
        Assertions.assertEquals(1, quarterSharp.getVerses().get(0).getN());
        Assertions.assertEquals("Hal", syl.getPlainText());
        Assertions.assertEquals(SylConnector.D, syl.getCon());
        Assertions.assertEquals(WordPosition.I, syl.getWordPos());

        Beam beam = (Beam) elements.get(1);
        Assertions.assertEquals(2, beam.getElements().size());
        Note sharp = (Note) beam.getElements().get(0);
        Assertions.assertEquals(AccidentalExplicit.SHARP, sharp.getAccid().getAccid());
        Assertions.assertEquals(AccidentalImplicit.NONE, sharp.getAccid().getAccidGes());
        Assertions.assertEquals(StemDirection.UP, sharp.getStemDir());
        Assertions.assertEquals(List.of(Articulation.ACC, Articulation.STACC), sharp.getArtics().get(0).getArtic());
        Assertions.assertEquals(WordPosition.T, sharp.getVerses().get(0).getSyls().get(0).getWordPos());

        //duration and stem of chord notes are kept by the chord
        Chord chord = (Chord) elements.get(2);
        Assertions.assertEquals(2, chord.getElements().size());
        Assertions.assertEquals(Duration.QUARTER, chord.getDur());
        Assertions.assertEquals(StemDirection.DOWN, chord.getStemDir());
        Note chordNote = (Note) chord.getElements().get(1);
        Assertions.assertEquals(PitchName.E, chordNote.getPname());
        Assertions.assertEquals(Duration.NONE, chordNote.getDur());
        Assertions.assertSame(chord, chordNote.getChord());
    }

    @Test
    public void testTupletClefAndFermata() {
        ImportResult result = importResource("notes.musicxml");
        ScoreDocument document = result.getDocument();

        List<LayerElement> elements = elementsOf(document, 1, 1, 1);
        Assertions.assertEquals(3, elements.size());
        Clef clef = (Clef) elements.get(0);
        Assertions.assertEquals(ClefShape.F, clef.getShape());
        Assertions.assertEquals(4, clef.getLine());

        Tuplet tuplet = (Tuplet) elements.get(1);
        Assertions.assertEquals(3, tuplet.getElements().size());
        Assertions.assertEquals(3, tuplet.getNum());
        Assertions.assertEquals(2, tuplet.getNumBase());
        Assertions.assertEquals(TupletNumberFormat.COUNT, tuplet.getNumFormat());
        Assertions.assertEquals(BooleanValue.TRUE, tuplet.getBracketVisible());
        Assertions.assertEquals(Duration.EIGHTH, ((Note) tuplet.getElements().get(0)).getDur());

        Rest rest = (Rest) elements.get(2);
        Assertions.assertEquals(Duration.HALF, rest.getDur());

        List<Fermata> fermatas = document.getSection(0).getMeasure(1).getControlElements(Fermata.class);
        Assertions.assertEquals(1, fermatas.size());
        Fermata fermata = fermatas.get(0);
        Assertions.assertEquals(FermataShape.CURVED, fermata.getShape());
        Assertions.assertEquals(FermataForm.NORM, fermata.getForm());
        Assertions.assertEquals(StaffRel.ABOVE, fermata.getPlace());
        Assertions.assertEquals(tuplet.getElements().get(2).getReference(), fermata.getStartId());
    }

    @Test
    public void testDirectionsAreAnchoredToTheNextNote() {
        ImportResult result = importResource("directions.musicxml");
        ScoreDocument document = result.getDocument();
        Measure measure = document.getSection(0).getMeasure(0);
        Note note = (Note) elementsOf(document, 0, 1, 1).get(0);

        List<ControlElement> controlElements = measure.getControlElements();
        Assertions.assertEquals(4, controlElements.size());
        for (ControlElement element : controlElements) {
            Assertions.assertEquals(note.getReference(), element.getStartId());
            Assertions.assertEquals(List.of(1), element.getStaff());
        }

        Dir dir = (Dir) controlElements.get(0);
        Assertions.assertEquals(StaffRel.ABOVE, dir.getPlace());
        Rend rend = (Rend) dir.getTexts().get(0);
        Assertions.assertEquals(FontStyle.ITALIC, rend.getFontStyle());
        Assertions.assertEquals("dolce", dir.getPlainText());

        Dynam dynam = (Dynam) controlElements.get(1);
        Assertions.assertEquals("p", dynam.getPlainText());
        Assertions.assertEquals(StaffRel.BELOW, dynam.getPlace());

        Tempo tempo = (Tempo) controlElements.get(2);
        Assertions.assertEquals(120, tempo.getMm());
        Assertions.assertEquals(Duration.QUARTER, tempo.getMmUnit());
        Assertions.assertEquals("M.M. = 120", tempo.getPlainText());

        Harm harm = (Harm) controlElements.get(3);
        Assertions.assertEquals("C♯m7", harm.getPlainText());

        Assertions.assertEquals(BarRendition.RPTEND, measure.getRight());
        Assertions.assertEquals(BarRendition.NONE, measure.getLeft());
        Assertions.assertTrue(containsWarning(result, "Unsupported direction-type 'rehearsal'"));
    }

    @Test
    public void testUnmatchedLinksAreReported() {
        ImportResult result = importResource("unmatched.musicxml");
        ScoreDocument document = result.getDocument();

        Assertions.assertTrue(containsWarning(result, "could not be matched"));
        Assertions.assertTrue(containsWarning(result, "Element 'Dynam' could not be added to measure '7'"));
        Assertions.assertTrue(containsWarning(result, "was never closed"));

        //the second part is merged into the first measure even though its number differs
        Measure measure = document.getSection(0).getMeasure(0);
        Assertions.assertEquals(1, document.getSection(0).getMeasureCount());
        Assertions.assertEquals(2, measure.getStaffCount());
        Assertions.assertTrue(measure.getControlElements(Dynam.class).isEmpty());
        Assertions.assertEquals(1, measure.getControlElements(Tie.class).size());
        Assertions.assertNull(measure.getControlElements(Tie.class).get(0).getEndId());
    }

    @Test
    public void testUnclosedLinksCanBeIgnored() {
        importer = new MusicXmlImporter(new ImportSettings().setReportUnclosedLinks(false));
        ImportResult result = importResource("unmatched.musicxml");
        Assertions.assertFalse(containsWarning(result, "was never closed"));
    }

    @Test
    public void testPartWithoutAttributesIsSkipped() {
        String xml = "<score-partwise><part-list><score-part id=\"P1\"><part-name>X</part-name></score-part></part-list>"
                + "<part id=\"P1\"><measure number=\"1\"><note><rest/><duration>1</duration></note></measure></part>"
                + "</score-partwise>";
        ImportResult result = importer.importString(xml);
        Assertions.assertTrue(containsWarning(result, "Could not find the 'attributes' element"));
        Assertions.assertEquals(0, result.getDocument().getSection(0).getMeasureCount());
        Assertions.assertTrue(result.getDocument().findAll(StaffDef.class).isEmpty());
    }

    @Test
    public void testExternalEntitiesAreNotExpanded(@TempDir Path dir) throws IOException {
        Path secret = dir.resolve("secret.txt");
        Files.writeString(secret, "TOPSECRET");
        String xml = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE score-partwise [<!ENTITY x SYSTEM \"" + secret.toUri() + "\">]>"
                + "<score-partwise><part-list><score-part id=\"P1\"><part-name>&x;</part-name></score-part></part-list>"
                + "<part id=\"P1\"><measure number=\"1\"><attributes><divisions>1</divisions></attributes>"
                + "<note><rest/><duration>1</duration><type>quarter</type></note></measure></part></score-partwise>";
        ScoreDocument document = importer.importString(xml).getDocument();
        List<StaffDef> staffDefs = document.findAll(StaffDef.class);
        Assertions.assertEquals(1, staffDefs.size());
        Assertions.assertFalse(StringUtils.contains(staffDefs.get(0).getLabel(), "TOPSECRET"));
    }

    @Test
    public void testFatalInput() {
        Assertions.assertThrows(MusicXmlImportException.class, () -> importer.importString("<score-timewise/>"));
        Assertions.assertThrows(MusicXmlImportException.class, () -> importer.importString("<score-partwise>"));
        Assertions.assertThrows(MusicXmlImportException.class, () -> importer.importFile(Paths.get("does-not-exist.musicxml")));
    }
}
