package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.data.AccidentalExplicit;
import net.scoreworks.scoretree.model.data.AccidentalImplicit;
import net.scoreworks.scoretree.model.data.BarRendition;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.CurveDirection;
import net.scoreworks.scoretree.model.data.Duration;
import net.scoreworks.scoretree.model.data.KeyMode;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.PedalDirection;
import net.scoreworks.scoretree.model.data.StemModifier;
import net.scoreworks.scoretree.model.data.TupletNumberFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MusicXmlConvertersTests {
    ImportDiagnostics diagnostics;
    MusicXmlConverters converters;

    @BeforeEach
    public void createConverters() {
        diagnostics = new ImportDiagnostics();
        converters = new MusicXmlConverters(diagnostics);
    }

    @Test
    public void testAlterations() {
        Assertions.assertEquals(AccidentalImplicit.QUARTER_SHARP, converters.alteration(0.5));
        Assertions.assertEquals(AccidentalImplicit.THREE_QUARTERS_FLAT, converters.alteration(-1.5));
        Assertions.assertEquals(AccidentalImplicit.NATURAL, converters.alteration(0));
        Assertions.assertFalse(diagnostics.hasWarnings());
        Assertions.assertEquals(AccidentalImplicit.NONE, converters.alteration(0.25));
        Assertions.assertEquals(1, diagnostics.getWarnings().size());
    }

    @Test
    public void testUnknownTokensAreWarned() {
        Assertions.assertEquals(AccidentalExplicit.NONE, converters.accidental("slash-sharp"));
        Assertions.assertEquals(Duration.NONE, converters.duration("1024th"));
        Assertions.assertEquals(CurveDirection.NONE, converters.orientation("sideways"));
        Assertions.assertEquals(3, diagnostics.getWarnings().size());
        Assertions.assertTrue(diagnostics.getWarnings().get(0).contains("slash-sharp"));
    }

    @Test
    public void testEmptyTokensAreNotWarned() {
        Assertions.assertEquals(AccidentalExplicit.NONE, converters.accidental(""));
        Assertions.assertEquals(Duration.NONE, converters.duration(""));
        Assertions.assertEquals(ClefShape.NONE, converters.clefShape(""));
        Assertions.assertEquals(BarRendition.NONE, converters.barRendition("", true));
        Assertions.assertEquals(BooleanValue.NONE, converters.bool("maybe"));
        Assertions.assertEquals(KeyMode.NONE, converters.keyMode(""));
        Assertions.assertFalse(diagnostics.hasWarnings());
    }

    @Test
    public void testBarRenditions() {
        Assertions.assertEquals(BarRendition.END, converters.barRendition("light-heavy", false));
        Assertions.assertEquals(BarRendition.RPTEND, converters.barRendition("light-heavy", true));
        Assertions.assertEquals(BarRendition.RPTSTART, converters.barRendition("heavy-light", true));
        Assertions.assertEquals(BarRendition.DBL, converters.barRendition("light-light", false));
        Assertions.assertEquals(BarRendition.INVIS, converters.barRendition("none", false));
        //heavy-light only exists as start repeat
        Assertions.assertEquals(BarRendition.NONE, converters.barRendition("heavy-light", false));
        Assertions.assertTrue(diagnostics.hasWarnings());
    }

    @Test
    public void testDurations() {
        Assertions.assertEquals(Duration.SIXTEENTH, converters.duration("16th"));
        Assertions.assertEquals(Duration.BREVE, converters.duration("breve"));
        Assertions.assertEquals(Duration.WHOLE, converters.durationCode(1));
        Assertions.assertEquals(Duration.EIGHTH, converters.durationCode(8));
        Assertions.assertEquals(Duration.TWO_HUNDRED_FIFTY_SIXTH, converters.durationCode(256));
        Assertions.assertEquals(Duration.NONE, converters.durationCode(3));
    }

    @Test
    public void testClefShapes() {
        Assertions.assertEquals(ClefShape.PERC, converters.clefShape("percussion"));
        Assertions.assertEquals(ClefShape.TAB, converters.clefShape("TAB"));
        Assertions.assertEquals(ClefShape.G, converters.clefShape(" G "));
        Assertions.assertFalse(diagnostics.hasWarnings());
    }

    @Test
    public void testSmallMappings() {
        Assertions.assertEquals(BooleanValue.TRUE, converters.bool("yes"));
        Assertions.assertEquals(BooleanValue.FALSE, converters.bool("no"));
        Assertions.assertEquals(KeyMode.DORIAN, converters.keyMode("dorian"));
        Assertions.assertEquals(StemModifier.SLASH_3, converters.stemModifier(3));
        Assertions.assertEquals(TupletNumberFormat.RATIO, converters.tupletNumberFormat("both"));
        Assertions.assertEquals(TupletNumberFormat.NONE, converters.tupletNumberFormat("none"));
        Assertions.assertEquals(OctaveDisplacement.FIFTEEN, converters.octaveDisplacement(15));
        Assertions.assertEquals(PedalDirection.UP, converters.pedalDirection("stop"));
        Assertions.assertEquals(CurveDirection.BELOW, converters.curveDirection("below"));
        Assertions.assertFalse(diagnostics.hasWarnings());
    }
}
