/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

/**
 * Options of a {@link MusicXmlImporter}. The defaults suit files exported by common notation programs
 */
public class ImportSettings {

    /**
     * MusicXML files declare the remote DTD of the format. Loading it requires network access, so it is off by default
     */
    private boolean loadExternalDtd;

    /**
     * Report ties, slurs and hairpins that were never closed once the import is done
     */
    private boolean reportUnclosedLinks = true;

    /**
     * Log every dispatched measure child at INFO level instead of DEBUG
     */
    private boolean verbose;

    public boolean isLoadExternalDtd() {
        return loadExternalDtd;
    }

    public ImportSettings setLoadExternalDtd(boolean loadExternalDtd) {
        this.loadExternalDtd = loadExternalDtd;
        return this;
    }

    public boolean isReportUnclosedLinks() {
        return reportUnclosedLinks;
    }

    public ImportSettings setReportUnclosedLinks(boolean reportUnclosedLinks) {
        this.reportUnclosedLinks = reportUnclosedLinks;
        return this;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public ImportSettings setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }
}
