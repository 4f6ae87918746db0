package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pitch-class summary of a progression, answering "is there a major/minor chord on X" by pitch
 * class so enharmonic spellings are interchangeable.
 */
public record ChordProfile(
        List<Chord> chords,
        Set<Integer> majorRoots,
        Set<Integer> minorRoots,
        Set<Integer> allRoots
) {
    public static ChordProfile from(List<Chord> chords) {
        Set<Integer> major = new HashSet<>();
        Set<Integer> minor = new HashSet<>();
        Set<Integer> all = new HashSet<>();

        for (Chord chord : chords) {
            int pitch = NoteTable.noteIndex(chord.root());
            if (pitch == NoteTable.NOT_FOUND) {
                continue;
            }
            all.add(pitch);
            switch (chord.quality()) {
                case MAJOR -> major.add(pitch);
                case MINOR -> minor.add(pitch);
                default -> {}
            }
        }

        return new ChordProfile(List.copyOf(chords), Set.copyOf(major), Set.copyOf(minor), Set.copyOf(all));
    }

    public boolean hasMajorOn(String note) {
        return contains(majorRoots, note);
    }

    public boolean hasMinorOn(String note) {
        return contains(minorRoots, note);
    }

    public boolean hasChordOn(String note) {
        return contains(allRoots, note);
    }

    public boolean isEmpty() {
        return chords.isEmpty();
    }

    private static boolean contains(Set<Integer> roots, String note) {
        int pitch = NoteTable.noteIndex(note);
        return pitch != NoteTable.NOT_FOUND && roots.contains(pitch);
    }
}
