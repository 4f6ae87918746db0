package com.chordanalyzer.infrastructure.analysis.scoring;

public record KeyScore(String key, int score, boolean invalid) {}
