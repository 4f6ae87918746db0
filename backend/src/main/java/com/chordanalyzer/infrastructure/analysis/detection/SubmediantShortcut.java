package com.chordanalyzer.infrastructure.analysis.detection;

import java.util.Set;

/**
 * A literal chord set that resolves straight to a key before the general VI* scan.
 *
 * @param requiredMajorRoots roots that must all be present as major chords
 * @param key                proposed key
 */
public record SubmediantShortcut(Set<String> requiredMajorRoots, String key) {

    public boolean matches(ChordProfile profile) {
        return requiredMajorRoots.stream().allMatch(profile::hasMajorOn);
    }
}
