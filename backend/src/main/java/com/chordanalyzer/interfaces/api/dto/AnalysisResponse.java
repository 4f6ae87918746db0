package com.chordanalyzer.interfaces.api.dto;

import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;

import java.util.List;

/**
 * @param key        detected key, null when nothing could be parsed
 * @param displayKey key label for display, "Unknown" when key is null
 * @param analysis   per-chord rows in input order
 */
public record AnalysisResponse(
        String key,
        String displayKey,
        List<Entry> analysis
) {
    private static final String UNKNOWN_KEY = "Unknown";

    public record Entry(
            String chord,
            String numeral,
            String function,
            boolean diatonic
    ) {}

    public static AnalysisResponse from(AnalysisResult result) {
        List<Entry> entries = result.analysis().stream()
                .map(AnalysisResponse::toEntry)
                .toList();
        return new AnalysisResponse(
                result.key(),
                result.hasKey() ? result.key() : UNKNOWN_KEY,
                entries);
    }

    private static Entry toEntry(AnalysisEntry e) {
        return new Entry(e.chord(), e.numeral(), e.function(), e.diatonic());
    }
}
