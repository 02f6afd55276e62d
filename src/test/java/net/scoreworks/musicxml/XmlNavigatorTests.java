package net.scoreworks.musicxml;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static net.scoreworks.musicxml.PartAttributesReaderTests.parse;

public class XmlNavigatorTests {
    XmlNavigator nav = new XmlNavigator();

    @Test
    public void testToInt() {
        Assertions.assertEquals(12, XmlNavigator.toInt(" 12abc"));
        Assertions.assertEquals(-3, XmlNavigator.toInt("-3"));
        Assertions.assertEquals(0, XmlNavigator.toInt("x1"));
        Assertions.assertEquals(0, XmlNavigator.toInt(null));
        Assertions.assertEquals(Integer.MAX_VALUE, XmlNavigator.toInt("99999999999"));
        Assertions.assertEquals(0.5, XmlNavigator.toDouble("0.5"));
        Assertions.assertEquals(0.0, XmlNavigator.toDouble("half"));
    }

    @Test
    public void testChildren() {
        Element note = parse("<note><pitch><step>C</step><octave>4</octave></pitch><dot/><dot/><chord/></note>");
        Assertions.assertEquals("C", XmlNavigator.childContent(note, "pitch/step"));
        Assertions.assertEquals("", XmlNavigator.childContent(note, "pitch/alter"));
        Assertions.assertEquals(2, XmlNavigator.children(note, "dot").size());
        Assertions.assertEquals("pitch", XmlNavigator.firstChildElement(note).getNodeName());
        Element dot = XmlNavigator.child(note, "dot");
        Assertions.assertNotNull(XmlNavigator.nextSibling(dot, "chord"));
        Assertions.assertNull(XmlNavigator.previousSibling(dot, "chord"));
        Assertions.assertEquals("", XmlNavigator.attribute(note, "color"));
        Assertions.assertEquals("", XmlNavigator.attribute(null, "color"));
    }

    @Test
    public void testPaths() {
        Element measure = parse("<measure><note><beam number=\"1\">begin</beam></note>"
                + "<note><beam number=\"2\">end</beam><beam number=\"1\">end</beam></note></measure>");
        Assertions.assertEquals(2, nav.selectAll(measure, "note").size());
        Element second = nav.selectAll(measure, "note").get(1);
        Assertions.assertTrue(nav.exists(second, "beam[@number='1'][text()='end']"));
        Assertions.assertFalse(nav.exists(second, "beam[@number='1'][text()='begin']"));
        Assertions.assertNull(nav.select(null, "beam"));
    }
}
