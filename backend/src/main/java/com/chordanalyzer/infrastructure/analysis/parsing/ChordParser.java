package com.chordanalyzer.infrastructure.analysis.parsing;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.domain.analysis.model.ChordQuality;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses chord symbols of the form {@code ROOT QUALITY? (/BASS)?}.
 * <p>
 * The quality part is free text scanned for substrings, so "m7b5", "min" and "-dim" all work
 * without a full chord grammar. Tokens that do not match are dropped without warning.
 * </p>
 */
@Component
public class ChordParser {

    private static final Pattern CHORD_PATTERN = Pattern.compile(
            "^([A-G][b#]?)([^/]*)(?:/([A-G][b#]?))?$"
    );

    private static final String TOKEN_SEPARATOR = ",";

    /**
     * Parse a comma-separated progression. Invalid tokens are skipped; order is preserved.
     */
    public List<Chord> parseProgression(String progression) {
        if (progression == null || progression.isBlank()) {
            return List.of();
        }
        return Pattern.compile(TOKEN_SEPARATOR).splitAsStream(progression)
                .map(this::parse)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Parse a single chord symbol.
     *
     * @return the chord, or empty if the token is not a chord symbol
     */
    public Optional<Chord> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String symbol = token.trim();
        Matcher matcher = CHORD_PATTERN.matcher(symbol);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String root = matcher.group(1);
        String qualityText = matcher.group(2);
        String bass = matcher.group(3);

        boolean seventh = qualityText.contains("7");
        boolean majorSeventh = qualityText.contains("maj7") || qualityText.contains("M7");

        return Optional.of(new Chord(root, resolveQuality(qualityText), seventh, majorSeventh, bass, symbol));
    }

    // "dim" contains an 'm', so diminished is checked before minor
    private ChordQuality resolveQuality(String qualityText) {
        if (qualityText.contains("dim") || qualityText.contains("°")) {
            return ChordQuality.DIMINISHED;
        }
        if (qualityText.contains("m") && !qualityText.contains("maj")) {
            return ChordQuality.MINOR;
        }
        if (qualityText.contains("aug") || qualityText.contains("+")) {
            return ChordQuality.AUGMENTED;
        }
        return ChordQuality.MAJOR;
    }
}
