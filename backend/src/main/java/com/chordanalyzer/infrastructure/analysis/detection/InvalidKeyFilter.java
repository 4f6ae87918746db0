package com.chordanalyzer.infrastructure.analysis.detection;

import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rejects candidate keys that would force borrowed-chord readings almost never seen in practice.
 * <p>
 * A key is invalid when the progression contains (any of):
 * <ol>
 *   <li>a minor chord on the flat second</li>
 *   <li>a minor chord on the flat fifth</li>
 *   <li>a major submediant together with a major flat sixth or flat seventh</li>
 *   <li>a major flat seventh together with a minor dominant</li>
 * </ol>
 */
@Slf4j
@Component
public class InvalidKeyFilter {

    public boolean isInvalid(String key, ChordProfile profile) {
        List<String> scale = NoteTable.majorScale(key);
        BorrowedDegrees borrowed = BorrowedDegrees.of(key);
        if (scale == null || borrowed == null) {
            return true;
        }

        // 1. minor bii
        if (profile.hasMinorOn(borrowed.flatSecond())) {
            log.debug("[InvalidKey] {}: minor chord on flat second {}", key, borrowed.flatSecond());
            return true;
        }

        // 2. minor bv
        if (profile.hasMinorOn(borrowed.flatFifth())) {
            log.debug("[InvalidKey] {}: minor chord on flat fifth {}", key, borrowed.flatFifth());
            return true;
        }

        // 3. VI* alongside bVI or bVII
        if (profile.hasMajorOn(scale.get(5))
                && (profile.hasMajorOn(borrowed.flatSixth()) || profile.hasMajorOn(borrowed.flatSeventh()))) {
            log.debug("[InvalidKey] {}: major submediant {} with borrowed bVI/bVII", key, scale.get(5));
            return true;
        }

        // 4. bVII alongside minor v
        if (profile.hasMajorOn(borrowed.flatSeventh()) && profile.hasMinorOn(scale.get(4))) {
            log.debug("[InvalidKey] {}: borrowed bVII {} with minor dominant", key, borrowed.flatSeventh());
            return true;
        }

        log.trace("[InvalidKey] {}: valid (borrowed degrees {})", key, borrowed);
        return false;
    }
}
