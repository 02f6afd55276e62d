/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the warnings of one import. Each warning is logged and kept, prefixed with the part and measure being
 * read when it occurred
 */
public class ImportDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(ImportDiagnostics.class);

    private final List<String> warnings = new ArrayList<>();
    private String partId;
    private Integer measureN;

    /**
     * Set the location prefixed to subsequent warnings. Pass null to clear a part of the location
     */
    public void setLocation(String partId, Integer measureN) {
        this.partId = partId;
        this.measureN = measureN;
    }

    /**
     * Record a warning. The message uses slf4j's {@code {}} placeholders
     */
    public void warn(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        String located = locationPrefix() + message;
        log.warn(located);
        warnings.add(located);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private String locationPrefix() {
        if (partId == null && measureN == null)
            return "";
        StringBuilder strb = new StringBuilder("[");
        if (partId != null)
            strb.append("part ").append(partId);
        if (measureN != null) {
            if (partId != null)
                strb.append(", ");
            strb.append("measure ").append(measureN);
        }
        return strb.append("] ").toString();
    }
}
