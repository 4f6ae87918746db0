package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * IV-V pattern: two major chords a whole step apart are read as IV and V, putting the key a
 * perfect fourth below the lower one (Eb, F -> Bb).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FourthPairDetector {

    private static final int WHOLE_STEP_UP = 2;
    private static final int WHOLE_STEP_DOWN = 10;
    private static final int PERFECT_FOURTH_DOWN = -5;

    private final InvalidKeyFilter invalidKeyFilter;

    /**
     * @return the first proposal (pairs scanned in progression order) that the invalid-key filter
     * accepts
     */
    public Optional<String> detect(ChordProfile profile) {
        List<Chord> majors = profile.chords().stream()
                .filter(Chord::isMajor)
                .toList();

        for (int i = 0; i < majors.size(); i++) {
            for (int j = i + 1; j < majors.size(); j++) {
                Chord first = majors.get(i);
                Chord second = majors.get(j);

                OptionalInt diff = NoteTable.semitoneDistance(first.root(), second.root());
                if (diff.isEmpty()) continue;

                Chord lower;
                if (diff.getAsInt() == WHOLE_STEP_UP) {
                    lower = first;
                } else if (diff.getAsInt() == WHOLE_STEP_DOWN) {
                    lower = second;
                } else {
                    continue;
                }

                String key = NoteTable.scaleDegree(lower.root(), PERFECT_FOURTH_DOWN);
                if (invalidKeyFilter.isInvalid(key, profile)) {
                    log.debug("[FourthPair] {}-{} proposes {} but key is invalid, skipping",
                            first.originalSymbol(), second.originalSymbol(), key);
                    continue;
                }
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
