package com.chordanalyzer.domain.analysis.model;

/**
 * A parsed chord symbol.
 *
 * @param root           root spelling as written (e.g. "Db", "F#")
 * @param quality        triad quality; exactly one per chord
 * @param seventh        true if the symbol carries a 7
 * @param majorSeventh   true for maj7 / M7
 * @param bass           slash-bass spelling, or null when absent
 * @param originalSymbol the trimmed token the chord was parsed from
 */
public record Chord(
        String root,
        ChordQuality quality,
        boolean seventh,
        boolean majorSeventh,
        String bass,
        String originalSymbol
) {
    public boolean isMajor() {
        return quality == ChordQuality.MAJOR;
    }

    public boolean isMinor() {
        return quality == ChordQuality.MINOR;
    }

    public boolean isDiminished() {
        return quality == ChordQuality.DIMINISHED;
    }

    public boolean isAugmented() {
        return quality == ChordQuality.AUGMENTED;
    }
}
