/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import net.scoreworks.scoretree.model.ControlElement;
import net.scoreworks.scoretree.model.Measure;
import net.scoreworks.scoretree.model.ScoreDef;
import net.scoreworks.scoretree.model.Section;
import net.scoreworks.scoretree.model.StaffDef;
import net.scoreworks.scoretree.model.StaffGrp;
import net.scoreworks.scoretree.model.data.BooleanValue;
import net.scoreworks.scoretree.model.data.StaffGroupSymbol;
import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static net.scoreworks.musicxml.XmlNavigator.attribute;
import static net.scoreworks.musicxml.XmlNavigator.child;
import static net.scoreworks.musicxml.XmlNavigator.childContent;
import static net.scoreworks.musicxml.XmlNavigator.childElements;
import static net.scoreworks.musicxml.XmlNavigator.children;
import static net.scoreworks.musicxml.XmlNavigator.hasAttributeValue;
import static net.scoreworks.musicxml.XmlNavigator.toDouble;

/**
 * Imports MusicXML documents in score-partwise format into a {@link net.scoreworks.scoretree.model.ScoreDocument}.
 * <p>
 * The document is read in one pass. Parts are read one after the other, their staves are numbered consecutively and
 * the measures of later parts are merged into the measures created by the first part. Ties, slurs, hairpins and
 * octave shifts are resolved while reading, control elements are added to their measures at the end.
 * <p>
 * Problems in the content never stop the import, they are collected as warnings in the {@link ImportResult}. Only
 * unreadable input or a root other than score-partwise throw a {@link MusicXmlImportException}.
 * An importer can be reused and shared between threads, each import has its own state.
 */
public class MusicXmlImporter {
    private static final Logger log = LoggerFactory.getLogger(MusicXmlImporter.class);

    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";
    private static final String EXTERNAL_GENERAL_ENTITIES = "http://xml.org/sax/features/external-general-entities";
    private static final String EXTERNAL_PARAMETER_ENTITIES = "http://xml.org/sax/features/external-parameter-entities";

    private final ImportSettings settings;

    public MusicXmlImporter() {
        this(new ImportSettings());
    }

    public MusicXmlImporter(ImportSettings settings) {
        this.settings = settings;
    }

    public ImportSettings getSettings() {
        return settings;
    }

    public @NotNull ImportResult importFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return importDocument(parse(new InputSource(in)));
        } catch (IOException e) {
            throw new MusicXmlImportException("Can't read " + path, e);
        }
    }

    public @NotNull ImportResult importString(String musicXml) {
        return importDocument(parse(new InputSource(new StringReader(musicXml))));
    }

    /**
     * Import an already parsed document. The document must not be parsed namespace aware
     */
    public @NotNull ImportResult importDocument(Document xml) {
        Element root = xml.getDocumentElement();
        if (root == null)
            throw new MusicXmlImportException("Document has no root element");
        if (!"score-partwise".equals(root.getNodeName()))
            throw new MusicXmlImportException("MusicXML root must be score-partwise but is " + root.getNodeName());

        ImportSession session = new ImportSession(settings);
        readScore(root, session);
        if (settings.isReportUnclosedLinks())
            session.stacks.reportUnclosed();
        return new ImportResult(session.document, session.diagnostics.getWarnings());
    }

    private Document parse(InputSource source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newDefaultInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            //entities declared in a score must never read other files
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(EXTERNAL_GENERAL_ENTITIES, false);
            factory.setFeature(EXTERNAL_PARAMETER_ENTITIES, false);
            //MusicXML files reference the DTD on the web
            factory.setFeature(LOAD_EXTERNAL_DTD, settings.isLoadExternalDtd());
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, settings.isLoadExternalDtd() ? "all" : "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(source);
        } catch (ParserConfigurationException e) {
            throw new MusicXmlImportException("Can't configure the XML parser", e);
        } catch (SAXException e) {
            throw new MusicXmlImportException("Malformed MusicXML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MusicXmlImportException("Can't read MusicXML input", e);
        }
    }

    private void readScore(Element root, ImportSession session) {
        ScoreDef scoreDef = session.document.getScoreDef();
        Section section = new Section(session.document);

        List<StaffGrp> staffGrpStack = new ArrayList<>();
        staffGrpStack.add(new StaffGrp(scoreDef));

        Element scoreTempo = session.navigator.select(root, "part[1]/measure[1]/sound[@tempo][1]");
        if (scoreTempo != null)
            scoreDef.setMidiBpm((int) toDouble(attribute(scoreTempo, "tempo")));

        PartAttributesReader attributesReader = new PartAttributesReader(session);
        MeasureReader measureReader = new MeasureReader(session);
        int staffOffset = 0;

        for (Element it : childElements(child(root, "part-list"))) {
            if ("part-group".equals(it.getNodeName())) {
                if (hasAttributeValue(it, "type", "start")) {
                    StaffGrp staffGrp = new StaffGrp(staffGrpStack.get(staffGrpStack.size() - 1));
                    staffGrp.setSymbol(groupSymbol(childContent(it, "group-symbol")));
                    staffGrpStack.add(staffGrp);
                }
                //the root group is never closed
                else if (staffGrpStack.size() > 1)
                    staffGrpStack.remove(staffGrpStack.size() - 1);
            }
            else if ("score-part".equals(it.getNodeName())) {
                String partId = attribute(it, "id");
                session.startPart(partId, staffOffset);
                Element part = findPart(root, partId);
                Element firstMeasure = child(part, "measure");
                if (firstMeasure == null || child(firstMeasure, "attributes") == null) {
                    session.diagnostics.warn("Could not find the 'attributes' element in the first measure of part '{}'", partId);
                    continue;
                }
                StaffGrp top = staffGrpStack.get(staffGrpStack.size() - 1);
                int nbStaves = readPartStaffDefs(it, firstMeasure, top, staffOffset, attributesReader, session);
                readPart(part, section, nbStaves, staffOffset, measureReader, session);
                staffOffset += nbStaves;
            }
        }
        session.diagnostics.setLocation(null, null);
        if (staffGrpStack.size() > 2)
            session.diagnostics.warn("{} part-groups were not closed", staffGrpStack.size() - 1);

        addControlElements(section, session);
    }

    /**
     * Read the staff definitions of a part. Several staves get a braced group labeled with the part name, a single
     * staff definition is labeled itself and added to the current group directly
     * @return the number of staves of the part
     */
    private int readPartStaffDefs(Element scorePart, Element firstMeasure, StaffGrp top, int staffOffset,
                                  PartAttributesReader attributesReader, ImportSession session) {
        String partName = childContent(scorePart, "part-name");
        String partAbbr = childContent(scorePart, "part-abbreviation");
        StaffGrp partStaffGrp = new StaffGrp(session.document);
        int nbStaves = attributesReader.readStaffDefs(firstMeasure, partStaffGrp, staffOffset);
        if (nbStaves > 1) {
            partStaffGrp.setLabel(partName);
            partStaffGrp.setLabelAbbr(partAbbr);
            partStaffGrp.setSymbol(StaffGroupSymbol.BRACE);
            partStaffGrp.setBarThru(BooleanValue.TRUE);
            partStaffGrp.attachTo(top);
        }
        else {
            StaffDef staffDef = partStaffGrp.findStaffDef(staffOffset + 1);
            if (staffDef != null) {
                staffDef.setLabel(partName);
                staffDef.setLabelAbbr(partAbbr);
            }
            top.moveMembersFrom(partStaffGrp);
            partStaffGrp.remove();
        }
        log.debug("Part '{}' '{}' with {} staves", attribute(scorePart, "id"), partName, nbStaves);
        return nbStaves;
    }

    private void readPart(Element part, Section section, int nbStaves, int staffOffset, MeasureReader measureReader,
                          ImportSession session) {
        List<Element> measures = children(part, "measure");
        if (measures.isEmpty()) {
            session.diagnostics.warn("No measure to load");
            return;
        }
        for (int i = 0; i < measures.size(); i++) {
            Measure measure = measureReader.readMeasure(measures.get(i), nbStaves, staffOffset);
            addMeasure(section, measure, i, session);
        }
    }

    /**
     * Add the i-th measure of a part. If a previous part created that measure already, the staves are moved into it
     */
    private void addMeasure(Section section, Measure measure, int i, ImportSession session) {
        if (i == section.getMeasureCount())
            measure.attachTo(section);
        else if (i < section.getMeasureCount())
            section.getMeasure(i).moveStavesFrom(measure);
        else
            session.diagnostics.warn("measures should be added in the right order");
    }

    private void addControlElements(Section section, ImportSession session) {
        Measure measure = null;
        for (Pair<Integer, ControlElement> entry : session.stacks.getControlElements()) {
            if (measure == null || measure.getN() != entry.getLeft())
                measure = section.findMeasure(entry.getLeft());
            if (measure == null) {
                session.diagnostics.warn("Element '{}' could not be added to measure '{}'",
                        entry.getRight().getClass().getSimpleName(), entry.getLeft());
                continue;
            }
            entry.getRight().attachTo(measure);
        }
    }

    private static Element findPart(Element root, String partId) {
        for (Element part : children(root, "part")) {
            if (partId.equals(attribute(part, "id")))
                return part;
        }
        return null;
    }

    private static StaffGroupSymbol groupSymbol(String symbol) {
        switch (symbol) {
            case "bracket": return StaffGroupSymbol.BRACKET;
            case "brace": return StaffGroupSymbol.BRACE;
            case "line": return StaffGroupSymbol.LINE;
            default: return StaffGroupSymbol.NONE;
        }
    }
}
