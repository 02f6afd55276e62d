package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.StaffDef;
import net.scoreworks.scoretree.model.StaffGrp;
import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.KeyMode;
import net.scoreworks.scoretree.model.data.KeySignature;
import net.scoreworks.scoretree.model.data.MeterSign;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.Place;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;

public class PartAttributesReaderTests {
    ImportSession session;
    PartAttributesReader reader;
    StaffGrp staffGrp;

    static Element parse(String xml) {
        try {
            return DocumentBuilderFactory.newDefaultInstance().newDocumentBuilder()
                    .parse(new InputSource(new StringReader(xml))).getDocumentElement();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @BeforeEach
    public void createReader() {
        session = new ImportSession(new ImportSettings());
        session.startPart("P2", 3);
        reader = new PartAttributesReader(session);
        staffGrp = new StaffGrp(session.document);
    }

    @Test
    public void testStavesOfAPart() {
        Element measure = parse("<measure number=\"1\"><print/><attributes>"
                + "<divisions>4</divisions><key><fifths>3</fifths></key>"
                + "<time symbol=\"common\"><beats>4</beats><beat-type>4</beat-type></time>"
                + "<staves>2</staves>"
                + "<clef number=\"1\"><sign>G</sign><line>2</line><clef-octave-change>-1</clef-octave-change></clef>"
                + "<clef number=\"2\"><sign>F</sign><line>4</line></clef>"
                + "<staff-details number=\"2\"><staff-lines>1</staff-lines></staff-details>"
                + "<transpose><diatonic>-1</diatonic><chromatic>-2</chromatic></transpose>"
                + "</attributes><note/></measure>");
        int nbStaves = reader.readStaffDefs(measure, staffGrp, 3);
        Assertions.assertEquals(2, nbStaves);
        Assertions.assertEquals(2, staffGrp.getMembers().size());
        Assertions.assertEquals(4, session.getPpq());
        Assertions.assertEquals(4, session.getMeterCount());

        StaffDef upper = staffGrp.findStaffDef(4);
        StaffDef lower = staffGrp.findStaffDef(5);
        Assertions.assertNotNull(upper);
        Assertions.assertNotNull(lower);
        Assertions.assertEquals(ClefShape.G, upper.getClefShape());
        Assertions.assertEquals(OctaveDisplacement.EIGHT, upper.getClefDis());
        Assertions.assertEquals(Place.BELOW, upper.getClefDisPlace());
        Assertions.assertEquals(ClefShape.F, lower.getClefShape());
        Assertions.assertEquals(KeySignature.ofFifths(3), lower.getKeySig());
        Assertions.assertEquals(3, lower.getKeySig().getSharps());
        Assertions.assertEquals(0, lower.getKeySig().getFlats());
        Assertions.assertFalse(lower.getKeySig().isMixed());
        Assertions.assertEquals(MeterSign.COMMON, lower.getMeterSign());
        Assertions.assertEquals(5, upper.getLines());
        Assertions.assertEquals(1, lower.getLines());
        Assertions.assertEquals(Integer.valueOf(-1), upper.getTransDiat());
        Assertions.assertEquals(Integer.valueOf(-2), lower.getTransSemi());
        Assertions.assertEquals(OctaveDisplacement.NONE, lower.getClefDis());

        //the attributes are not read again by the measure
        Assertions.assertTrue(session.isConsumed((Element) measure.getElementsByTagName("attributes").item(0)));
        Assertions.assertEquals(0, session.stacks.getOctaveDisplacement(5));
    }

    @Test
    public void testAdditiveMeter() {
        Element measure = parse("<measure number=\"1\"><attributes>"
                + "<time><beats>3+2</beats><beat-type>8</beat-type></time></attributes></measure>");
        Assertions.assertEquals(1, reader.readStaffDefs(measure, staffGrp, 3));
        StaffDef staffDef = staffGrp.findStaffDef(4);
        Assertions.assertEquals(Integer.valueOf(5), staffDef.getMeterCount());
        Assertions.assertEquals(Integer.valueOf(8), staffDef.getMeterUnit());
        Assertions.assertEquals(1, session.diagnostics.getWarnings().size());
        Assertions.assertTrue(session.diagnostics.getWarnings().get(0).startsWith("[part P2]"));
    }

    @Test
    public void testKeys() {
        Element measure = parse("<measure number=\"1\"><attributes><staves>2</staves>"
                + "<key number=\"1\"><fifths>-4</fifths><mode>dorian</mode></key>"
                + "<key number=\"2\"><key-step>F</key-step><key-alter>1</key-alter></key></attributes></measure>");
        reader.readStaffDefs(measure, staffGrp, 3);
        KeySignature upper = staffGrp.findStaffDef(4).getKeySig();
        Assertions.assertEquals(4, upper.getFlats());
        Assertions.assertEquals(0, upper.getSharps());
        Assertions.assertEquals("4f", upper.toString());
        Assertions.assertEquals(KeyMode.DORIAN, staffGrp.findStaffDef(4).getKeyMode());
        KeySignature lower = staffGrp.findStaffDef(5).getKeySig();
        Assertions.assertTrue(lower.isMixed());
        Assertions.assertSame(KeySignature.MIXED, lower);
    }

    @Test
    public void testOnlyLeadingAttributesAreRead() {
        Element measure = parse("<measure number=\"1\"><attributes><divisions>2</divisions></attributes>"
                + "<note/><attributes><staves>3</staves></attributes></measure>");
        Assertions.assertEquals(1, reader.readStaffDefs(measure, staffGrp, 3));
        Assertions.assertEquals(2, session.getPpq());
        Assertions.assertEquals(1, staffGrp.getMembers().size());
    }
}
