package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Rotation pattern: a major chord A and a minor chord B a major third above it (IV-vi, I-iii)
 * suggest A is the subdominant, so the key is a fifth above A.
 * Every ordered pair is counted, so repeated chords strengthen the tally.
 */
@Component
public class RotationDetector {

    private static final int MAJOR_THIRD = 4;
    private static final int PERFECT_FIFTH = 7;

    public RotationTally detect(List<Chord> chords) {
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (int i = 0; i < chords.size(); i++) {
            Chord a = chords.get(i);
            if (!a.isMajor()) continue;

            for (int j = 0; j < chords.size(); j++) {
                if (i == j) continue;
                Chord b = chords.get(j);
                if (!b.isMinor()) continue;

                OptionalInt diff = NoteTable.semitoneDistance(a.root(), b.root());
                if (diff.isPresent() && diff.getAsInt() == MAJOR_THIRD) {
                    String candidate = NoteTable.scaleDegree(a.root(), PERFECT_FIFTH);
                    counts.merge(candidate, 1, Integer::sum);
                }
            }
        }

        if (counts.isEmpty()) {
            return RotationTally.none();
        }

        String bestKey = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                bestCount = entry.getValue();
                bestKey = entry.getKey();
            }
        }
        return new RotationTally(Collections.unmodifiableMap(counts), bestKey, bestCount);
    }
}
