package com.chordanalyzer.infrastructure.analysis.theory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Pitch-class table, major scales and enharmonic lookups.
 * <p>
 * Built once at class initialisation and never mutated. Scales are spelled with the canonical
 * (sharp) names and are registered under both spellings of their tonic, so "Db" and "C#" resolve
 * to the same sequence.
 * </p>
 */
public final class NoteTable {

    private NoteTable() {
    }

    public static final int NOT_FOUND = -1;

    private static final String[] CANONICAL = {
            "C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"
    };

    private static final String[] ALIAS = {
            null, "Db", null, "Eb", null, null, "Gb", null, "Ab", null, "Bb", null
    };

    private static final int[] MAJOR_SCALE_PATTERN = {0, 2, 4, 5, 7, 9, 11};

    private static final Map<String, String> ENHARMONIC_TWINS = Map.of(
            "C#", "Db", "Db", "C#",
            "D#", "Eb", "Eb", "D#",
            "F#", "Gb", "Gb", "F#",
            "G#", "Ab", "Ab", "G#",
            "A#", "Bb", "Bb", "A#"
    );

    private static final Map<String, String> PREFERRED_KEY_SPELLING = Map.of(
            "G#", "Ab",
            "D#", "Eb",
            "A#", "Bb",
            "C#", "Db",
            "F#", "Gb"
    );

    private static final Map<String, List<String>> MAJOR_SCALES = buildMajorScales();

    /** Candidate keys in canonical spelling, C first. */
    private static final List<String> CANDIDATE_KEYS = List.of(CANONICAL);

    private static Map<String, List<String>> buildMajorScales() {
        Map<String, List<String>> scales = new LinkedHashMap<>();
        for (int root = 0; root < 12; root++) {
            String[] notes = new String[MAJOR_SCALE_PATTERN.length];
            for (int i = 0; i < MAJOR_SCALE_PATTERN.length; i++) {
                notes[i] = CANONICAL[(root + MAJOR_SCALE_PATTERN[i]) % 12];
            }
            List<String> scale = List.of(notes);
            scales.put(CANONICAL[root], scale);
            if (ALIAS[root] != null) {
                scales.put(ALIAS[root], scale);
            }
        }
        return Collections.unmodifiableMap(scales);
    }

    public static List<String> candidateKeys() {
        return CANDIDATE_KEYS;
    }

    /**
     * @return the major scale of the given tonic (either spelling), or null if unknown
     */
    public static List<String> majorScale(String tonic) {
        return tonic == null ? null : MAJOR_SCALES.get(tonic);
    }

    /**
     * @return pitch class 0-11, or {@link #NOT_FOUND}
     */
    public static int noteIndex(String note) {
        if (note == null) {
            return NOT_FOUND;
        }
        for (int i = 0; i < CANONICAL.length; i++) {
            if (CANONICAL[i].equals(note) || note.equals(ALIAS[i])) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * True when both spellings resolve to the same pitch class.
     */
    public static boolean samePitch(String a, String b) {
        int ia = noteIndex(a);
        return ia != NOT_FOUND && ia == noteIndex(b);
    }

    /**
     * Upward distance in semitones (0-11) from {@code from} to {@code to}; empty if either note
     * is unknown.
     */
    public static OptionalInt semitoneDistance(String from, String to) {
        int i1 = noteIndex(from);
        int i2 = noteIndex(to);
        if (i1 == NOT_FOUND || i2 == NOT_FOUND) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((i2 - i1 + 12) % 12);
    }

    public static String scaleDegree(String root, int semitones) {
        return scaleDegree(root, semitones, null);
    }

    /**
     * Transposes {@code root} by {@code semitones} (negative values allowed). When a target scale
     * is given and it contains the enharmonic twin of the result, the twin is returned instead.
     *
     * @return the transposed spelling, or null if the root is unknown
     */
    public static String scaleDegree(String root, int semitones, List<String> scale) {
        int index = noteIndex(root);
        if (index == NOT_FOUND) {
            return null;
        }
        int adjusted = ((semitones % 12) + 12) % 12;
        String result = CANONICAL[(index + adjusted) % 12];
        if (scale != null) {
            String twin = ENHARMONIC_TWINS.get(result);
            if (twin != null && scale.contains(twin)) {
                return twin;
            }
        }
        return result;
    }

    /**
     * @return index 0-6 of the note in the scale, trying its enharmonic twin as a fallback,
     * or {@link #NOT_FOUND}
     */
    public static int positionInScale(String note, List<String> scale) {
        if (note == null || scale == null) {
            return NOT_FOUND;
        }
        int direct = scale.indexOf(note);
        if (direct != NOT_FOUND) {
            return direct;
        }
        String twin = ENHARMONIC_TWINS.get(note);
        return twin != null ? scale.indexOf(twin) : NOT_FOUND;
    }

    public static String enharmonicTwin(String note) {
        return ENHARMONIC_TWINS.get(note);
    }

    public static String preferredKeySpelling(String key) {
        return key == null ? null : PREFERRED_KEY_SPELLING.getOrDefault(key, key);
    }
}
