package com.chordanalyzer.infrastructure.analysis.scoring;

import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * A named bonus applied to every candidate key after base scoring.
 */
public record ScoringRule(String name, ToIntFunction<KeyScoringContext> bonus) {

    public static ScoringRule when(String name, Predicate<KeyScoringContext> condition, int value) {
        return new ScoringRule(name, ctx -> condition.test(ctx) ? value : 0);
    }

    public int apply(KeyScoringContext ctx) {
        return bonus.applyAsInt(ctx);
    }
}
