package com.chordanalyzer.interfaces.api.dto;

import com.chordanalyzer.domain.analysis.model.ExampleProgression;

public record ExampleProgressionResponse(
        String name,
        String chords,
        String expectedKey
) {
    public static ExampleProgressionResponse from(ExampleProgression example) {
        return new ExampleProgressionResponse(example.name(), example.chords(), example.expectedKey());
    }
}
