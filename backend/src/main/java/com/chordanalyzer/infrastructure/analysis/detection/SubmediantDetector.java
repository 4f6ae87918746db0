package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * VI* pattern: a major chord on a key's normally-minor sixth degree, backed by that key's I and IV
 * (or IV and V), marks the key as the likely home, e.g. A, C, F reads as VI*-I-IV in C rather
 * than III*-V-I in F.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmediantDetector {

    /** Checked in order before the general scan. */
    static final List<SubmediantShortcut> SHORTCUTS = List.of(
            new SubmediantShortcut(Set.of("A", "C", "F"), "C"),
            new SubmediantShortcut(Set.of("F", "Ab", "Db"), "Ab")
    );

    private final InvalidKeyFilter invalidKeyFilter;

    public Optional<String> detect(ChordProfile profile) {
        for (SubmediantShortcut shortcut : SHORTCUTS) {
            if (shortcut.matches(profile)) {
                log.debug("[Submediant] shortcut {} -> {}", shortcut.requiredMajorRoots(), shortcut.key());
                return Optional.of(shortcut.key());
            }
        }

        for (String key : NoteTable.candidateKeys()) {
            if (invalidKeyFilter.isInvalid(key, profile)) continue;

            List<String> scale = NoteTable.majorScale(key);
            if (!profile.hasMajorOn(scale.get(5))) continue;

            boolean hasOne = profile.hasMajorOn(scale.get(0));
            boolean hasFour = profile.hasMajorOn(scale.get(3));
            boolean hasFive = profile.hasMajorOn(scale.get(4));

            if ((hasOne && hasFour) || (hasFour && hasFive)) {
                log.debug("[Submediant] major {} is VI* in {}", scale.get(5), key);
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
