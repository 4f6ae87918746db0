package com.chordanalyzer.domain.analysis.model;

/**
 * Roman-numeral analysis of a single chord in the detected key.
 *
 * @param chord    original chord symbol
 * @param numeral  Roman numeral, suffixed with '*' when non-diatonic
 * @param function functional label (Tonic, Dominant, Borrowed Chord, ...)
 * @param diatonic true if root and quality match the key's scale degree
 */
public record AnalysisEntry(
        String chord,
        String numeral,
        String function,
        boolean diatonic
) {}
