package com.chordanalyzer.infrastructure.analysis.numeral;

import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.detection.BorrowedDegrees;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Labels a chord with a Roman numeral and harmonic function relative to a major key.
 * <p>
 * Order of resolution:
 * <ol>
 *   <li>non-minor chord on bVI / bVII: fixed borrowed label</li>
 *   <li>root in the scale: degree numeral, '*' when the quality is not the expected one</li>
 *   <li>otherwise: chromatic numeral from the semitone distance to the tonic</li>
 * </ol>
 */
@Component
public class NumeralGenerator {

    static final String BORROWED_FUNCTION = "Borrowed Chord";
    static final String UNKNOWN_FUNCTION = "Unknown";
    private static final String NON_DIATONIC_MARK = "*";

    private static final List<String> CHROMATIC_NUMERALS = List.of(
            "I", "bII", "II", "bIII", "III", "IV", "bV", "V", "bVI", "VI", "bVII", "VII"
    );

    public AnalysisEntry label(Chord chord, String key) {
        List<String> scale = NoteTable.majorScale(key);
        if (scale == null || NoteTable.noteIndex(chord.root()) == NoteTable.NOT_FOUND) {
            return new AnalysisEntry(chord.originalSymbol(), "?", UNKNOWN_FUNCTION, false);
        }

        BorrowedDegrees borrowed = BorrowedDegrees.of(key);
        if (!chord.isMinor()) {
            if (NoteTable.samePitch(chord.root(), borrowed.flatSixth())) {
                return borrowedEntry(chord, "bVI" + NON_DIATONIC_MARK);
            }
            if (NoteTable.samePitch(chord.root(), borrowed.flatSeventh())) {
                return borrowedEntry(chord, "bVII" + NON_DIATONIC_MARK);
            }
        }

        int position = NoteTable.positionInScale(chord.root(), scale);
        if (position != NoteTable.NOT_FOUND) {
            ScaleDegree degree = ScaleDegree.at(position);
            boolean diatonic = degree.isDiatonic(chord);

            String numeral = decorate(degree.numeral(), chord);
            if (!diatonic) {
                numeral += NON_DIATONIC_MARK;
            }
            return new AnalysisEntry(chord.originalSymbol(), numeral, functionName(degree, chord), diatonic);
        }

        return chromaticEntry(chord, scale.get(0));
    }

    private AnalysisEntry chromaticEntry(Chord chord, String tonic) {
        OptionalInt distance = NoteTable.semitoneDistance(tonic, chord.root());
        if (distance.isEmpty()) {
            return new AnalysisEntry(chord.originalSymbol(), "?", UNKNOWN_FUNCTION, false);
        }
        String numeral = decorate(CHROMATIC_NUMERALS.get(distance.getAsInt()), chord) + NON_DIATONIC_MARK;
        return new AnalysisEntry(chord.originalSymbol(), numeral, BORROWED_FUNCTION, false);
    }

    private AnalysisEntry borrowedEntry(Chord chord, String numeral) {
        return new AnalysisEntry(chord.originalSymbol(), numeral, BORROWED_FUNCTION, false);
    }

    /**
     * Applies case, quality sign and seventh suffix to an upper-case base numeral.
     */
    static String decorate(String base, Chord chord) {
        String numeral = switch (chord.quality()) {
            case MINOR -> base.toLowerCase(Locale.ROOT);
            case DIMINISHED -> base.toLowerCase(Locale.ROOT) + "°";
            case AUGMENTED -> base + "+";
            case MAJOR -> base;
        };
        if (chord.seventh()) {
            numeral += chord.majorSeventh() ? "maj7" : "7";
        }
        return numeral;
    }

    private static String functionName(ScaleDegree degree, Chord chord) {
        if (chord.isMajor()) {
            String override = switch (degree) {
                case SUPERTONIC -> "V of V";
                case MEDIANT -> "Phrygian Dominant";
                case SUBMEDIANT -> "Tierce de Picardie";
                default -> null;
            };
            if (override != null) {
                return override;
            }
        }
        if (chord.isMinor() && degree == ScaleDegree.SUBDOMINANT) {
            return "Minor Four";
        }
        return degree.functionName();
    }
}
