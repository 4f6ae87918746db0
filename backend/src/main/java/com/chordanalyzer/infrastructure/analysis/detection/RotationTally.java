package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;

import java.util.Map;

/**
 * Rotation proposals per key.
 *
 * @param counts    proposals per key (canonical spelling), in first-seen order
 * @param bestKey   most frequent proposal, first-seen wins ties; null if none
 * @param bestCount tally of {@code bestKey}
 */
public record RotationTally(
        Map<String, Integer> counts,
        String bestKey,
        int bestCount
) {
    public static RotationTally none() {
        return new RotationTally(Map.of(), null, 0);
    }

    public int countFor(String key) {
        return counts.entrySet().stream()
                .filter(e -> NoteTable.samePitch(e.getKey(), key))
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    public boolean isBest(String key) {
        return bestKey != null && NoteTable.samePitch(bestKey, key);
    }
}
