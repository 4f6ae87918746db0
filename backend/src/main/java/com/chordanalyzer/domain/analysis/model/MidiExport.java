package com.chordanalyzer.domain.analysis.model;

/**
 * A rendered Standard MIDI File ready for download.
 */
public record MidiExport(String fileName, byte[] bytes) {}
