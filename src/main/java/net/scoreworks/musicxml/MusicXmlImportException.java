/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml;

/**
 * Thrown if an input can't be imported at all: it is no well-formed XML, it can't be read or its root is not a
 * part-wise score. Problems inside a readable score never throw, they are reported as warnings
 */
public class MusicXmlImportException extends RuntimeException {

    public MusicXmlImportException(String message) {
        super(message);
    }

    public MusicXmlImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
