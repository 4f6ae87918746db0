package com.chordanalyzer.infrastructure.midi;

public class MidiExportException extends RuntimeException {

    public MidiExportException(String message) {
        super(message);
    }

    public MidiExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
