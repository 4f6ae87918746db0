package com.chordanalyzer.infrastructure.analysis.scoring;

import com.chordanalyzer.infrastructure.analysis.detection.BorrowedDegrees;
import com.chordanalyzer.infrastructure.analysis.detection.ChordProfile;
import com.chordanalyzer.infrastructure.analysis.detection.KeyProposals;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree;

import java.util.List;

/**
 * Everything a scoring rule may look at for one candidate key.
 */
public record KeyScoringContext(
        String key,
        List<String> scale,
        BorrowedDegrees borrowed,
        ChordProfile profile,
        KeyProposals proposals
) {
    public static KeyScoringContext of(String key, ChordProfile profile, KeyProposals proposals) {
        return new KeyScoringContext(key, NoteTable.majorScale(key), BorrowedDegrees.of(key), profile, proposals);
    }

    public boolean hasMajorDegree(ScaleDegree degree) {
        return profile.hasMajorOn(scale.get(degree.position()));
    }

    public boolean hasMinorDegree(ScaleDegree degree) {
        return profile.hasMinorOn(scale.get(degree.position()));
    }

    public boolean hasAnyChordOnDegree(ScaleDegree degree) {
        return profile.hasChordOn(scale.get(degree.position()));
    }

    public boolean hasBorrowedFlatSixOrSeven() {
        return profile.hasMajorOn(borrowed.flatSixth()) || profile.hasMajorOn(borrowed.flatSeventh());
    }

    public boolean isProposed(String proposal) {
        return proposal != null && NoteTable.samePitch(proposal, key);
    }
}
