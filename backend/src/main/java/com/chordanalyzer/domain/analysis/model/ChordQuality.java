package com.chordanalyzer.domain.analysis.model;

public enum ChordQuality {
    MAJOR, MINOR, DIMINISHED, AUGMENTED
}
