package com.chordanalyzer.domain.analysis.model;

public record ExampleProgression(String name, String chords, String expectedKey) {}
