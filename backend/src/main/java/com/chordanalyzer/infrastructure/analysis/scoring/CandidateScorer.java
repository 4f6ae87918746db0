package com.chordanalyzer.infrastructure.analysis.scoring;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.detection.ChordProfile;
import com.chordanalyzer.infrastructure.analysis.detection.InvalidKeyFilter;
import com.chordanalyzer.infrastructure.analysis.detection.KeyProposals;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.DOMINANT;
import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.MEDIANT;
import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.SUBDOMINANT;
import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.SUBMEDIANT;
import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.SUPERTONIC;
import static com.chordanalyzer.infrastructure.analysis.theory.ScaleDegree.TONIC;

/**
 * Scores all twelve major keys against a progression and picks the best valid one.
 * <p>
 * Base score counts diatonic chords plus a few presence bonuses; then {@link #BONUS_RULES} are
 * applied in order. The weights are hand-tuned against known progressions: changing a value or
 * the order changes which key wins on ambiguous input.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateScorer {

    static final int INVALID_KEY_PENALTY = -1000;

    static final List<ScoringRule> BONUS_RULES = List.of(
            ScoringRule.when("submediant-pattern",
                    ctx -> ctx.isProposed(ctx.proposals().submediantKey()), 10),

            new ScoringRule("fourth-pair-pattern", ctx -> {
                if (!ctx.isProposed(ctx.proposals().fourthPairKey())) return 0;
                return ctx.hasMajorDegree(TONIC) ? 8 : 4;
            }),

            new ScoringRule("rotation-pattern", ctx -> {
                int bonus = ctx.proposals().rotation().countFor(ctx.key()) * 2;
                if (ctx.proposals().rotation().isBest(ctx.key()) && ctx.proposals().rotation().bestCount() >= 2) {
                    bonus += 2;
                }
                return bonus;
            }),

            ScoringRule.when("vi-I-IV",
                    ctx -> ctx.hasMinorDegree(SUBMEDIANT) && ctx.hasMajorDegree(TONIC) && ctx.hasMajorDegree(SUBDOMINANT), 12),

            ScoringRule.when("VI*-IV-II*-without-tonic",
                    ctx -> !ctx.hasAnyChordOnDegree(TONIC)
                            && ctx.hasMajorDegree(SUBMEDIANT) && ctx.hasMajorDegree(SUBDOMINANT) && ctx.hasMajorDegree(SUPERTONIC), 10)
    );

    private final InvalidKeyFilter invalidKeyFilter;

    /**
     * Score every candidate key, in table order.
     */
    public List<KeyScore> score(ChordProfile profile, KeyProposals proposals) {
        List<KeyScore> scores = new ArrayList<>();
        for (String key : NoteTable.candidateKeys()) {
            KeyScoringContext ctx = KeyScoringContext.of(key, profile, proposals);
            boolean invalid = invalidKeyFilter.isInvalid(key, profile);

            int score = invalid ? INVALID_KEY_PENALTY : baseScore(ctx);
            for (ScoringRule rule : BONUS_RULES) {
                int bonus = rule.apply(ctx);
                if (bonus != 0) {
                    log.trace("[KeyScoring] {} +{} ({})", key, bonus, rule.name());
                }
                score += bonus;
            }

            scores.add(new KeyScore(key, score, invalid));
        }
        log.debug("[KeyScoring] scores={}", scores);
        return scores;
    }

    /**
     * Highest score wins, earlier keys win ties. An invalid winner is replaced by the best valid
     * key when one exists.
     *
     * @return canonical spelling of the chosen key, empty for an empty progression
     */
    public Optional<String> selectKey(ChordProfile profile, KeyProposals proposals) {
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        List<KeyScore> scores = score(profile, proposals);

        KeyScore best = highest(scores, false);
        if (best != null && best.invalid()) {
            KeyScore bestValid = highest(scores, true);
            if (bestValid != null) {
                log.debug("[KeyScoring] winner {} is invalid, falling back to {}", best.key(), bestValid.key());
                best = bestValid;
            }
        }
        return Optional.ofNullable(best).map(KeyScore::key);
    }

    int baseScore(KeyScoringContext ctx) {
        int score = 0;

        for (Chord chord : ctx.profile().chords()) {
            int position = NoteTable.positionInScale(chord.root(), ctx.scale());
            if (position != NoteTable.NOT_FOUND && ScaleDegree.isDiatonic(chord, position)) {
                score += 2;
            }
        }

        if (ctx.hasMajorDegree(TONIC)) score += 1;
        if (ctx.hasMajorDegree(SUBDOMINANT)) score += 1;
        if (ctx.hasMajorDegree(DOMINANT)) score += 1;

        // borrowed mediant (III*)
        if (ctx.hasMajorDegree(MEDIANT)) score += 3;

        // VI*
        if (ctx.hasMajorDegree(SUBMEDIANT)) score += 2;

        if (ctx.hasMajorDegree(TONIC) && ctx.hasMinorDegree(SUBMEDIANT) && ctx.hasBorrowedFlatSixOrSeven()) {
            score += 4;
        }

        return score;
    }

    private static KeyScore highest(List<KeyScore> scores, boolean validOnly) {
        KeyScore best = null;
        for (KeyScore candidate : scores) {
            if (validOnly && candidate.invalid()) continue;
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }
        return best;
    }
}
