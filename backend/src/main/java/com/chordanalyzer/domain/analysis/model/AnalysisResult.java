package com.chordanalyzer.domain.analysis.model;

import java.util.List;

/**
 * Output of a single analysis run.
 *
 * @param key      detected key in preferred spelling, or null when no chord could be parsed
 * @param analysis one entry per parsed chord, in input order
 */
public record AnalysisResult(
        String key,
        List<AnalysisEntry> analysis
) {
    public static AnalysisResult empty() {
        return new AnalysisResult(null, List.of());
    }

    public boolean hasKey() {
        return key != null;
    }
}
