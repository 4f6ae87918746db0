package com.chordanalyzer.infrastructure.analysis.theory;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.domain.analysis.model.ChordQuality;

/**
 * The seven degrees of a major scale with their numeral, function name and expected triad quality.
 */
public enum ScaleDegree {
    TONIC("I", "Tonic", ChordQuality.MAJOR),
    SUPERTONIC("II", "Supertonic", ChordQuality.MINOR),
    MEDIANT("III", "Mediant", ChordQuality.MINOR),
    SUBDOMINANT("IV", "Subdominant", ChordQuality.MAJOR),
    DOMINANT("V", "Dominant", ChordQuality.MAJOR),
    SUBMEDIANT("VI", "Submediant", ChordQuality.MINOR),
    LEADING_TONE("VII", "Leading Tone", ChordQuality.DIMINISHED);

    private static final ScaleDegree[] VALUES = values();

    private final String numeral;
    private final String functionName;
    private final ChordQuality expectedQuality;

    ScaleDegree(String numeral, String functionName, ChordQuality expectedQuality) {
        this.numeral = numeral;
        this.functionName = functionName;
        this.expectedQuality = expectedQuality;
    }

    public static ScaleDegree at(int position) {
        return VALUES[position];
    }

    public int position() {
        return ordinal();
    }

    public String numeral() {
        return numeral;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Augmented chords never match any degree.
     */
    public boolean isDiatonic(Chord chord) {
        return chord.quality() == expectedQuality;
    }

    public static boolean isDiatonic(Chord chord, int position) {
        if (position < 0 || position > 6) {
            return false;
        }
        return at(position).isDiatonic(chord);
    }
}
