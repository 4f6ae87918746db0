package com.chordanalyzer.infrastructure.analysis.parsing;

import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.domain.analysis.model.ChordQuality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChordParserTest {

    private ChordParser parser;

    @BeforeEach
    void setUp() {
        parser = new ChordParser();
    }

    private Chord parse(String token) {
        return parser.parse(token).orElseThrow();
    }

    @Nested
    @DisplayName("코드 품질")
    class Quality {

        @Test
        void major_triad() {
            Chord chord = parse("C");
            assertThat(chord.root()).isEqualTo("C");
            assertThat(chord.quality()).isEqualTo(ChordQuality.MAJOR);
            assertThat(chord.seventh()).isFalse();
            assertThat(chord.bass()).isNull();
        }

        @Test
        void minor_variants() {
            assertThat(parse("Am").quality()).isEqualTo(ChordQuality.MINOR);
            assertThat(parse("Ebmin").quality()).isEqualTo(ChordQuality.MINOR);
            assertThat(parse("F#m7b5").quality()).isEqualTo(ChordQuality.MINOR);
        }

        @Test
        @DisplayName("dim의 'm'은 마이너로 보지 않음")
        void diminished_is_not_minor() {
            Chord chord = parse("Bdim");
            assertThat(chord.quality()).isEqualTo(ChordQuality.DIMINISHED);
            assertThat(chord.isMinor()).isFalse();
            assertThat(parse("B°").quality()).isEqualTo(ChordQuality.DIMINISHED);
        }

        @Test
        void augmented() {
            assertThat(parse("Caug").quality()).isEqualTo(ChordQuality.AUGMENTED);
            assertThat(parse("G+").quality()).isEqualTo(ChordQuality.AUGMENTED);
        }

        @Test
        @DisplayName("maj 포함은 마이너 아님")
        void maj_is_not_minor() {
            assertThat(parse("Cmaj7").quality()).isEqualTo(ChordQuality.MAJOR);
        }
    }

    @Nested
    @DisplayName("세븐스")
    class Sevenths {

        @Test
        void dominant_seventh() {
            Chord chord = parse("G7");
            assertThat(chord.seventh()).isTrue();
            assertThat(chord.majorSeventh()).isFalse();
        }

        @Test
        void major_seventh_spellings() {
            assertThat(parse("Cmaj7").majorSeventh()).isTrue();
            assertThat(parse("CM7").majorSeventh()).isTrue();
            assertThat(parse("CM7").quality()).isEqualTo(ChordQuality.MAJOR);
        }

        @Test
        void minor_seventh() {
            Chord chord = parse("Dm7");
            assertThat(chord.quality()).isEqualTo(ChordQuality.MINOR);
            assertThat(chord.seventh()).isTrue();
            assertThat(chord.majorSeventh()).isFalse();
        }
    }

    @Test
    @DisplayName("슬래시 베이스 캡처")
    void slash_bass() {
        Chord chord = parse("C/E");
        assertThat(chord.root()).isEqualTo("C");
        assertThat(chord.bass()).isEqualTo("E");
        assertThat(chord.originalSymbol()).isEqualTo("C/E");
    }

    @Test
    @DisplayName("앞뒤 공백 제거 후 원래 기호 보존")
    void trims_token() {
        Chord chord = parse("  Bbm7 ");
        assertThat(chord.root()).isEqualTo("Bb");
        assertThat(chord.originalSymbol()).isEqualTo("Bbm7");
    }

    @Nested
    @DisplayName("잘못된 토큰")
    class InvalidTokens {

        @Test
        void rejected_silently() {
            assertThat(parser.parse("")).isEmpty();
            assertThat(parser.parse("H")).isEmpty();
            assertThat(parser.parse("c")).isEmpty();
            assertThat(parser.parse("C/H")).isEmpty();
            assertThat(parser.parse(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("parseProgression")
    class Progression {

        @Test
        @DisplayName("잘못된 토큰은 건너뛰고 순서 유지")
        void skips_invalid_keeps_order() {
            List<Chord> chords = parser.parseProgression("C, H, Am,, G7 ,F");
            assertThat(chords).extracting(Chord::originalSymbol)
                    .containsExactly("C", "Am", "G7", "F");
        }

        @Test
        void blank_input() {
            assertThat(parser.parseProgression("")).isEmpty();
            assertThat(parser.parseProgression("   ")).isEmpty();
            assertThat(parser.parseProgression(null)).isEmpty();
        }
    }
}
