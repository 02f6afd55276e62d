/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.ControlElement;
import net.scoreworks.scoretree.model.Hairpin;
import net.scoreworks.scoretree.model.Layer;
import net.scoreworks.scoretree.model.LayerElement;
import net.scoreworks.scoretree.model.LayerElementOwner;
import net.scoreworks.scoretree.model.Note;
import net.scoreworks.scoretree.model.Octave;
import net.scoreworks.scoretree.model.Slur;
import net.scoreworks.scoretree.model.Tie;
import net.scoreworks.scoretree.model.data.PitchName;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.collections4.MultiValuedMap;
import org.apache.commons.collections4.multimap.ArrayListValuedHashMap;
import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping of everything that is opened by one MusicXML element and completed by a later one:
 * <ul>
 *     <li>containers (beams, tuplets, chords, tremolos) that collect the following events of a layer</li>
 *     <li>ties, slurs and hairpins waiting for their end</li>
 *     <li>directions waiting for the next note to be anchored to</li>
 *     <li>octave shifts in effect per staff</li>
 *     <li>control elements waiting for their measure</li>
 * </ul>
 * Ties, slurs and hairpins are closed by scanning all open entries, not only the last one, since several of them may
 * be open at the same time.
 */
public class CrossReferenceStacks {

    /**
     * Kinds of control elements that get their start anchor from the next note
     */
    public enum PendingKind {
        DIR, DYNAM, HARM, OCTAVE, PEDAL, TEMPO
    }

    private final ImportDiagnostics diagnostics;

    private final List<LayerElementOwner> elementStack = new ArrayList<>();
    private final List<OpenTie> tieStack = new ArrayList<>();
    private final List<OpenSlur> slurStack = new ArrayList<>();
    private final List<OpenHairpin> hairpinStack = new ArrayList<>();
    private final MultiValuedMap<PendingKind, ControlElement> pending = new ArrayListValuedHashMap<>();
    private final Map<Integer, Integer> octaveDisplacement = new HashMap<>();
    private final List<Pair<Integer, ControlElement>> controlElements = new ArrayList<>();

    public CrossReferenceStacks(ImportDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }


    //==========OPEN ELEMENTS====================================================

    public void pushElement(LayerElementOwner container) {
        elementStack.add(container);
    }

    /**
     * @return the innermost open container or null
     */
    public @Nullable LayerElementOwner topElement() {
        return elementStack.isEmpty() ? null : elementStack.get(elementStack.size() - 1);
    }

    /**
     * Remove the innermost open container of the given type. Containers opened later stay open
     */
    public void removeLastElement(Class<? extends LayerElementOwner> type) {
        for (int i = elementStack.size() - 1; i >= 0; i--) {
            if (type.isInstance(elementStack.get(i))) {
                elementStack.remove(i);
                return;
            }
        }
    }

    public boolean hasOpenElements() {
        return !elementStack.isEmpty();
    }

    public int getOpenElementCount() {
        return elementStack.size();
    }

    public void clearElements() {
        elementStack.clear();
    }

    /**
     * @return the owner for a new event of the given layer: the innermost open container, or the layer itself
     */
    public LayerElementOwner ownerFor(Layer layer) {
        LayerElementOwner top = topElement();
        return top != null ? top : layer;
    }


    //==========TIES, SLURS AND HAIRPINS====================================================

    public void openTie(int staffN, int layerN, Note note, Tie tie) {
        tie.setStartId(note.getReference());
        tieStack.add(new OpenTie(tie, staffN, layerN, note.getPname(), note.getOct()));
    }

    /**
     * Close the open tie of the same staff, layer and pitch as the given note, if there is one. A tie is closed even
     * if the note has no stop marker
     * @param isClosingTie whether the note has a tie stop marker
     */
    public void closeTie(int staffN, int layerN, Note note, boolean isClosingTie) {
        for (Iterator<OpenTie> it = tieStack.iterator(); it.hasNext(); ) {
            OpenTie openTie = it.next();
            if (openTie.matches(staffN, layerN, note.getPname(), note.getOct())) {
                openTie.tie.setEndId(note.getReference());
                it.remove();
                if (!isClosingTie)
                    diagnostics.warn("Closing tie for note '{}' even though tie stop is missing", note.getId());
                return;
            }
        }
    }

    /**
     * @param startId reference of the event the slur starts at
     */
    public void openSlur(int staffN, int layerN, int number, Slur slur, String startId) {
        slur.setStartId(startId);
        slurStack.add(new OpenSlur(slur, staffN, layerN, number));
    }

    public void closeSlur(int staffN, int layerN, int number, LayerElement element) {
        for (Iterator<OpenSlur> it = slurStack.iterator(); it.hasNext(); ) {
            OpenSlur openSlur = it.next();
            if (openSlur.matches(staffN, layerN, number)) {
                openSlur.slur.setEndId(element.getReference());
                it.remove();
                return;
            }
        }
        diagnostics.warn("Closing slur for element '{}' could not be matched", element.getId());
    }

    public void openHairpin(int number, Hairpin hairpin) {
        hairpinStack.add(new OpenHairpin(hairpin, number));
    }

    /**
     * Close the first open hairpin with the given number, on any staff. It ends at the last note read since it was
     * opened
     * @return false if no hairpin with that number is open
     */
    public boolean closeHairpin(int number) {
        for (Iterator<OpenHairpin> it = hairpinStack.iterator(); it.hasNext(); ) {
            OpenHairpin openHairpin = it.next();
            if (openHairpin.number == number) {
                openHairpin.hairpin.setEndId(openHairpin.endId);
                it.remove();
                return true;
            }
        }
        return false;
    }

    public int getOpenTieCount() {
        return tieStack.size();
    }

    public int getOpenSlurCount() {
        return slurStack.size();
    }

    public int getOpenHairpinCount() {
        return hairpinStack.size();
    }


    //==========DEFERRED ATTACHMENT====================================================

    public void defer(PendingKind kind, ControlElement element) {
        pending.put(kind, element);
    }

    public int getPendingCount(PendingKind kind) {
        return pending.get(kind).size();
    }

    /**
     * Anchor all pending control elements to the event just read and clear them. Open hairpins get their start
     * anchor from the first event read after they were opened, their end anchor candidate from every event
     * @param staffN staff of the event
     * @param reference reference of the event
     */
    public void anchorPending(int staffN, String reference) {
        for (PendingKind kind : PendingKind.values()) {
            for (ControlElement element : pending.get(kind)) {
                element.setStaff(staffN);
                element.setStartId(reference);
            }
        }
        pending.clear();
        for (OpenHairpin openHairpin : hairpinStack) {
            if (openHairpin.hairpin.getStartId() == null) {
                openHairpin.hairpin.setStaff(staffN);
                openHairpin.hairpin.setStartId(reference);
            }
            openHairpin.endId = reference;
        }
    }


    //==========OCTAVE SHIFTS====================================================

    /**
     * @return the signed number of octaves notes of the staff are written away from where they sound
     */
    public int getOctaveDisplacement(int staffN) {
        return MapUtils.getIntValue(octaveDisplacement, staffN, 0);
    }

    public void setOctaveDisplacement(int staffN, int octaves) {
        octaveDisplacement.put(staffN, octaves);
    }

    /**
     * End the octave shift of a staff. Every octave line of that staff that has no end yet ends at the given
     * reference, even if it was anchored before
     */
    public void stopOctaveShift(int staffN, @Nullable String reference) {
        octaveDisplacement.put(staffN, 0);
        for (Pair<Integer, ControlElement> entry : controlElements) {
            if (entry.getRight() instanceof Octave) {
                Octave octave = (Octave) entry.getRight();
                if (octave.getStaff().contains(staffN) && octave.getEndId() == null)
                    octave.setEndId(reference);
            }
        }
    }


    //==========CONTROL ELEMENTS====================================================

    /**
     * Remember a control element to be added to the measure with the given number once all parts are read
     */
    public void addControlElement(int measureN, ControlElement element) {
        controlElements.add(Pair.of(measureN, element));
    }

    public List<Pair<Integer, ControlElement>> getControlElements() {
        return Collections.unmodifiableList(controlElements);
    }

    /**
     * Warn about every tie, slur and hairpin that was never closed
     */
    public void reportUnclosed() {
        for (OpenTie openTie : tieStack)
            diagnostics.warn("Tie starting at '{}' was never closed", openTie.tie.getStartId());
        for (OpenSlur openSlur : slurStack)
            diagnostics.warn("Slur starting at '{}' was never closed", openSlur.slur.getStartId());
        for (OpenHairpin openHairpin : hairpinStack)
            diagnostics.warn("Hairpin {} starting at '{}' was never closed", openHairpin.number, openHairpin.hairpin.getStartId());
    }


    private static final class OpenTie {
        final Tie tie;
        final int staffN;
        final int layerN;
        final PitchName pname;
        final int oct;

        OpenTie(Tie tie, int staffN, int layerN, PitchName pname, int oct) {
            this.tie = tie;
            this.staffN = staffN;
            this.layerN = layerN;
            this.pname = pname;
            this.oct = oct;
        }

        boolean matches(int staffN, int layerN, PitchName pname, int oct) {
            return this.staffN == staffN && this.layerN == layerN && this.pname == pname && this.oct == oct;
        }
    }

    private static final class OpenSlur {
        final Slur slur;
        final int staffN;
        final int layerN;
        final int number;

        OpenSlur(Slur slur, int staffN, int layerN, int number) {
            this.slur = slur;
            this.staffN = staffN;
            this.layerN = layerN;
            this.number = number;
        }

        boolean matches(int staffN, int layerN, int number) {
            return this.staffN == staffN && this.layerN == layerN && this.number == number;
        }
    }

    private static final class OpenHairpin {
        final Hairpin hairpin;
        final int number;
        /** reference of the last event read while the hairpin is open */
        String endId;

        OpenHairpin(Hairpin hairpin, int number) {
            this.hairpin = hairpin;
            this.number = number;
        }
    }
}
