/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.data.AccidentalExplicit;
import net.scoreworks.scoretree.model.data.AccidentalImplicit;
import net.scoreworks.scoretree.model.data.BarRendition;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.ClefShape;
import net.scoreworks.scoretree.model.data.CurveDirection;
import net.scoreworks.scoretree.model.data.Duration;
import net.scoreworks.scoretree.model.data.FermataShape;
import net.scoreworks.scoretree.model.data.FontStyle;
import net.scoreworks.scoretree.model.data.FontWeight;
import net.scoreworks.scoretree.model.data.HorizontalAlignment;
import net.scoreworks.scoretree.model.data.KeyMode;
import net.scoreworks.scoretree.model.data.OctaveDisplacement;
import net.scoreworks.scoretree.model.data.PedalDirection;
import net.scoreworks.scoretree.model.data.PitchName;
import net.scoreworks.scoretree.model.data.StaffRel;
import net.scoreworks.scoretree.model.data.StemModifier;
import net.scoreworks.scoretree.model.data.TupletNumberFormat;
import org.apache.commons.lang3.StringUtils;

/**
 * Mappings from MusicXML tokens to the values of the score tree. Every mapping is total: an empty token maps to the
 * NONE value of the target type, an unknown token does the same after a warning
 */
public class MusicXmlConverters {
    private final ImportDiagnostics diagnostics;

    public MusicXmlConverters(ImportDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public AccidentalExplicit accidental(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return AccidentalExplicit.NONE;
            case "sharp": return AccidentalExplicit.SHARP;
            case "natural": return AccidentalExplicit.NATURAL;
            case "flat": return AccidentalExplicit.FLAT;
            case "double-sharp": return AccidentalExplicit.DOUBLE_SHARP;
            case "sharp-sharp": return AccidentalExplicit.SHARP_SHARP;
            case "flat-flat": return AccidentalExplicit.FLAT_FLAT;
            case "natural-sharp": return AccidentalExplicit.NATURAL_SHARP;
            case "natural-flat": return AccidentalExplicit.NATURAL_FLAT;
            case "quarter-flat": return AccidentalExplicit.QUARTER_FLAT;
            case "quarter-sharp": return AccidentalExplicit.QUARTER_SHARP;
            case "three-quarters-flat": return AccidentalExplicit.THREE_QUARTERS_FLAT;
            case "three-quarters-sharp": return AccidentalExplicit.THREE_QUARTERS_SHARP;
            default:
                diagnostics.warn("Unsupported accidental value '{}'", value);
                return AccidentalExplicit.NONE;
        }
    }

    /**
     * Map a chromatic alteration in half steps. Only multiples of a quarter tone between -2 and 2 are supported
     */
    public AccidentalImplicit alteration(double value) {
        if (value == -2) return AccidentalImplicit.DOUBLE_FLAT;
        if (value == -1.5) return AccidentalImplicit.THREE_QUARTERS_FLAT;
        if (value == -1) return AccidentalImplicit.FLAT;
        if (value == -0.5) return AccidentalImplicit.QUARTER_FLAT;
        if (value == 0) return AccidentalImplicit.NATURAL;
        if (value == 0.5) return AccidentalImplicit.QUARTER_SHARP;
        if (value == 1) return AccidentalImplicit.SHARP;
        if (value == 1.5) return AccidentalImplicit.THREE_QUARTERS_SHARP;
        if (value == 2) return AccidentalImplicit.DOUBLE_SHARP;
        diagnostics.warn("Unsupported alter value '{}'", value);
        return AccidentalImplicit.NONE;
    }

    /**
     * @param style the bar-style of a barline
     * @param repeat whether the barline has a repeat sign
     */
    public BarRendition barRendition(String style, boolean repeat) {
        switch (StringUtils.trimToEmpty(style)) {
            case "":
                return BarRendition.NONE;
            case "dashed": return BarRendition.DASHED;
            case "dotted": return BarRendition.DOTTED;
            case "light-light": return BarRendition.DBL;
            case "none": return BarRendition.INVIS;
            case "regular": return BarRendition.SINGLE;
            case "light-heavy":
                return repeat ? BarRendition.RPTEND : BarRendition.END;
            case "heavy-light":
                if (repeat)
                    return BarRendition.RPTSTART;
                break;
            default:
                break;
        }
        diagnostics.warn("Unsupported bar-style '{}'", style);
        return BarRendition.NONE;
    }

    /**
     * Map yes and no. Anything else is NONE, without warning since the value is optional everywhere
     */
    public BooleanValue bool(String value) {
        if ("yes".equals(value)) return BooleanValue.TRUE;
        if ("no".equals(value)) return BooleanValue.FALSE;
        return BooleanValue.NONE;
    }

    /**
     * Map a note type like "quarter" or "16th"
     */
    public Duration duration(String type) {
        switch (StringUtils.trimToEmpty(type)) {
            case "": return Duration.NONE;
            case "maxima": return Duration.MAXIMA;
            case "long": return Duration.LONG;
            case "breve": return Duration.BREVE;
            case "whole": return Duration.WHOLE;
            case "half": return Duration.HALF;
            case "quarter": return Duration.QUARTER;
            case "eighth": return Duration.EIGHTH;
            case "16th": return Duration.SIXTEENTH;
            case "32nd": return Duration.THIRTY_SECOND;
            case "64th": return Duration.SIXTY_FOURTH;
            case "128th": return Duration.HUNDRED_TWENTY_EIGHTH;
            case "256th": return Duration.TWO_HUNDRED_FIFTY_SIXTH;
            default:
                diagnostics.warn("Unsupported type '{}'", type);
                return Duration.NONE;
        }
    }

    /**
     * Map a duration code, the denominator of the note value (1 for a whole note, 4 for a quarter...)
     */
    public Duration durationCode(int code) {
        switch (code) {
            case 1: return Duration.WHOLE;
            case 2: return Duration.HALF;
            case 4: return Duration.QUARTER;
            case 8: return Duration.EIGHTH;
            case 16: return Duration.SIXTEENTH;
            case 32: return Duration.THIRTY_SECOND;
            case 64: return Duration.SIXTY_FOURTH;
            case 128: return Duration.HUNDRED_TWENTY_EIGHTH;
            case 256: return Duration.TWO_HUNDRED_FIFTY_SIXTH;
            default:
                diagnostics.warn("Unsupported duration '{}'", code);
                return Duration.NONE;
        }
    }

    /**
     * Map the number of tremolo slashes to a stem modifier
     */
    public StemModifier stemModifier(int slashes) {
        for (StemModifier stemMod : StemModifier.values()) {
            if (stemMod != StemModifier.NONE && stemMod.getSlashes() == slashes)
                return stemMod;
        }
        diagnostics.warn("Unsupported number of tremolo slashes '{}'", slashes);
        return StemModifier.NONE;
    }

    public PitchName pitchName(String step) {
        switch (StringUtils.trimToEmpty(step)) {
            case "": return PitchName.NONE;
            case "C": return PitchName.C;
            case "D": return PitchName.D;
            case "E": return PitchName.E;
            case "F": return PitchName.F;
            case "G": return PitchName.G;
            case "A": return PitchName.A;
            case "B": return PitchName.B;
            default:
                diagnostics.warn("Unsupported pitch name '{}'", step);
                return PitchName.NONE;
        }
    }

    /**
     * Map the orientation of a tie or slur
     */
    public CurveDirection orientation(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return CurveDirection.NONE;
            case "over": return CurveDirection.ABOVE;
            case "under": return CurveDirection.BELOW;
            default:
                diagnostics.warn("Unsupported orientation '{}'", value);
                return CurveDirection.NONE;
        }
    }

    /**
     * Map a placement to a curve direction, used where the placement overrides the orientation
     */
    public CurveDirection curveDirection(String placement) {
        switch (StringUtils.trimToEmpty(placement)) {
            case "": return CurveDirection.NONE;
            case "above": return CurveDirection.ABOVE;
            case "below": return CurveDirection.BELOW;
            default:
                diagnostics.warn("Unsupported placement '{}'", placement);
                return CurveDirection.NONE;
        }
    }

    /**
     * Map the content of a fermata. An empty fermata is a normal one, its shape is left unset
     */
    public FermataShape fermataShape(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return FermataShape.NONE;
            case "normal": return FermataShape.CURVED;
            case "angled": return FermataShape.ANGULAR;
            case "square": return FermataShape.SQUARE;
            default:
                diagnostics.warn("Unsupported fermata shape '{}'", value);
                return FermataShape.NONE;
        }
    }

    public PedalDirection pedalDirection(String type) {
        switch (StringUtils.trimToEmpty(type)) {
            case "": return PedalDirection.NONE;
            case "start": return PedalDirection.DOWN;
            case "stop": return PedalDirection.UP;
            default:
                diagnostics.warn("Unsupported type '{}' for pedal", type);
                return PedalDirection.NONE;
        }
    }

    /**
     * Map the show-number attribute of a tuplet. "none" is handled by the caller as invisible number
     */
    public TupletNumberFormat tupletNumberFormat(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "actual": return TupletNumberFormat.COUNT;
            case "both": return TupletNumberFormat.RATIO;
            case "":
            case "none":
                return TupletNumberFormat.NONE;
            default:
                diagnostics.warn("Unsupported show-number '{}'", value);
                return TupletNumberFormat.NONE;
        }
    }

    /**
     * Map a placement attribute relative to the staff
     */
    public StaffRel staffRel(String placement) {
        switch (StringUtils.trimToEmpty(placement)) {
            case "": return StaffRel.NONE;
            case "above": return StaffRel.ABOVE;
            case "below": return StaffRel.BELOW;
            case "between": return StaffRel.BETWEEN;
            case "within": return StaffRel.WITHIN;
            default:
                diagnostics.warn("Unsupported placement '{}'", placement);
                return StaffRel.NONE;
        }
    }

    /**
     * Map a clef sign. Only the first four characters are considered, so "percussion" is recognized as well
     */
    public ClefShape clefShape(String sign) {
        String value = StringUtils.left(StringUtils.trimToEmpty(sign), 4);
        switch (value) {
            case "": return ClefShape.NONE;
            case "G": return ClefShape.G;
            case "GG": return ClefShape.GG;
            case "F": return ClefShape.F;
            case "C": return ClefShape.C;
            case "perc": return ClefShape.PERC;
            case "TAB": return ClefShape.TAB;
            default:
                diagnostics.warn("Unsupported clef sign '{}'", sign);
                return ClefShape.NONE;
        }
    }

    /**
     * Map the size of an octave shift (8, 15 or 22)
     */
    public OctaveDisplacement octaveDisplacement(int size) {
        switch (size) {
            case 8: return OctaveDisplacement.EIGHT;
            case 15: return OctaveDisplacement.FIFTEEN;
            case 22: return OctaveDisplacement.TWENTY_TWO;
            default:
                diagnostics.warn("Unsupported octave-shift size '{}'", size);
                return OctaveDisplacement.NONE;
        }
    }

    public KeyMode keyMode(String mode) {
        String value = StringUtils.trimToEmpty(mode);
        if (value.isEmpty())
            return KeyMode.NONE;
        for (KeyMode keyMode : KeyMode.values()) {
            if (keyMode != KeyMode.NONE && keyMode.name().equalsIgnoreCase(value))
                return keyMode;
        }
        diagnostics.warn("Unsupported mode '{}'", mode);
        return KeyMode.NONE;
    }

    public FontStyle fontStyle(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return FontStyle.NONE;
            case "italic": return FontStyle.ITALIC;
            case "normal": return FontStyle.NORMAL;
            case "oblique": return FontStyle.OBLIQUE;
            default:
                diagnostics.warn("Unsupported font-style '{}'", value);
                return FontStyle.NONE;
        }
    }

    public FontWeight fontWeight(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return FontWeight.NONE;
            case "bold": return FontWeight.BOLD;
            case "normal": return FontWeight.NORMAL;
            default:
                diagnostics.warn("Unsupported font-weight '{}'", value);
                return FontWeight.NONE;
        }
    }

    public HorizontalAlignment horizontalAlignment(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "": return HorizontalAlignment.NONE;
            case "left": return HorizontalAlignment.LEFT;
            case "right": return HorizontalAlignment.RIGHT;
            case "center": return HorizontalAlignment.CENTER;
            case "justify": return HorizontalAlignment.JUSTIFY;
            default:
                diagnostics.warn("Unsupported halign '{}'", value);
                return HorizontalAlignment.NONE;
        }
    }
}
