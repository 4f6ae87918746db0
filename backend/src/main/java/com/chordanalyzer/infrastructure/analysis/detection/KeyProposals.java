package com.chordanalyzer.infrastructure.analysis.detection;

/**
 * Combined output of the pattern detectors for one progression.
 *
 * @param submediantKey VI* proposal, nullable
 * @param fourthPairKey IV-V proposal, nullable
 * @param rotation      rotation tally, never null
 */
public record KeyProposals(
        String submediantKey,
        String fourthPairKey,
        RotationTally rotation
) {
    public static KeyProposals none() {
        return new KeyProposals(null, null, RotationTally.none());
    }
}
