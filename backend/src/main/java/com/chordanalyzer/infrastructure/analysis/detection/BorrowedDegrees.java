package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;

import java.util.List;

/**
 * Lowered scale degrees of a major key, i.e. the roots of chords usually borrowed from the
 * parallel minor or Phrygian/Locrian colour.
 */
public record BorrowedDegrees(
        String flatSecond,
        String flatFifth,
        String flatSixth,
        String flatSeventh
) {
    /**
     * @param key tonic of the candidate key, either spelling
     * @return the degrees, or null if the key is unknown
     */
    public static BorrowedDegrees of(String key) {
        List<String> scale = NoteTable.majorScale(key);
        if (scale == null) {
            return null;
        }
        String tonic = scale.get(0);
        return new BorrowedDegrees(
                NoteTable.scaleDegree(scale.get(1), -1, scale),
                NoteTable.scaleDegree(scale.get(4), -1, scale),
                NoteTable.scaleDegree(tonic, 8, scale),
                NoteTable.scaleDegree(tonic, 10, scale)
        );
    }
}
