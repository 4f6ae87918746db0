package com.chordanalyzer.infrastructure.analysis.numeral;

import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.infrastructure.analysis.parsing.ChordParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumeralGeneratorTest {

    private final ChordParser parser = new ChordParser();
    private NumeralGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new NumeralGenerator();
    }

    private AnalysisEntry label(String chord, String key) {
        return generator.label(parser.parse(chord).orElseThrow(), key);
    }

    @Nested
    @DisplayName("다이어토닉 코드")
    class Diatonic {

        @Test
        void primary_triads() {
            assertThat(label("C", "C")).isEqualTo(new AnalysisEntry("C", "I", "Tonic", true));
            assertThat(label("F", "C")).isEqualTo(new AnalysisEntry("F", "IV", "Subdominant", true));
            assertThat(label("G", "C")).isEqualTo(new AnalysisEntry("G", "V", "Dominant", true));
        }

        @Test
        void minor_triads_lowercase() {
            assertThat(label("Dm", "C").numeral()).isEqualTo("ii");
            assertThat(label("Em", "C").numeral()).isEqualTo("iii");
            assertThat(label("Am", "C")).isEqualTo(new AnalysisEntry("Am", "vi", "Submediant", true));
        }

        @Test
        @DisplayName("세븐스 접미사")
        void sevenths() {
            assertThat(label("Dm7", "C")).isEqualTo(new AnalysisEntry("Dm7", "ii7", "Supertonic", true));
            assertThat(label("G7", "C").numeral()).isEqualTo("V7");
            assertThat(label("Cmaj7", "C").numeral()).isEqualTo("Imaj7");
        }

        @Test
        @DisplayName("감화음: 소문자 + °")
        void diminished_leading_tone() {
            assertThat(label("Bdim", "C")).isEqualTo(new AnalysisEntry("Bdim", "vii°", "Leading Tone", true));
            assertThat(label("B°7", "C").numeral()).isEqualTo("vii°7");
        }

        @Test
        @DisplayName("플랫 조성에서 플랫 표기 코드")
        void flat_spelling_in_flat_key() {
            assertThat(label("Db", "Ab")).isEqualTo(new AnalysisEntry("Db", "IV", "Subdominant", true));
            assertThat(label("Bbm", "G#").numeral()).isEqualTo("ii");
        }
    }

    @Nested
    @DisplayName("논다이어토닉 재명명")
    class FunctionOverrides {

        @Test
        void major_supertonic_is_secondary_dominant() {
            assertThat(label("D", "C")).isEqualTo(new AnalysisEntry("D", "II*", "V of V", false));
        }

        @Test
        void major_mediant() {
            assertThat(label("E", "C")).isEqualTo(new AnalysisEntry("E", "III*", "Phrygian Dominant", false));
        }

        @Test
        void minor_subdominant() {
            assertThat(label("Fm", "C")).isEqualTo(new AnalysisEntry("Fm", "iv*", "Minor Four", false));
        }

        @Test
        void major_submediant() {
            assertThat(label("A", "C")).isEqualTo(new AnalysisEntry("A", "VI*", "Tierce de Picardie", false));
        }

        @Test
        @DisplayName("증화음: 대문자 + '+' + '*'")
        void augmented_tonic() {
            assertThat(label("Caug", "C")).isEqualTo(new AnalysisEntry("Caug", "I+*", "Tonic", false));
        }

        @Test
        @DisplayName("마이너 세븐스 V")
        void minor_dominant_seventh() {
            assertThat(label("Gm7", "C").numeral()).isEqualTo("v7*");
        }
    }

    @Nested
    @DisplayName("차용 화음")
    class Borrowed {

        @Test
        @DisplayName("bVI / bVII 고정 라벨")
        void flat_six_and_seven() {
            assertThat(label("Ab", "C")).isEqualTo(new AnalysisEntry("Ab", "bVI*", "Borrowed Chord", false));
            assertThat(label("Bb7", "C")).isEqualTo(new AnalysisEntry("Bb7", "bVII*", "Borrowed Chord", false));
            assertThat(label("G#", "C").numeral()).isEqualTo("bVI*");
        }

        @Test
        @DisplayName("마이너 bvi는 반음계 표기")
        void minor_flat_six_is_chromatic() {
            assertThat(label("Abm", "C")).isEqualTo(new AnalysisEntry("Abm", "bvi*", "Borrowed Chord", false));
        }

        @Test
        @DisplayName("스케일 밖 근음 → 반음계 숫자")
        void chromatic_fallback() {
            assertThat(label("Db", "C")).isEqualTo(new AnalysisEntry("Db", "bII*", "Borrowed Chord", false));
            assertThat(label("Ebm7", "C").numeral()).isEqualTo("biii7*");
            assertThat(label("F#dim", "C").numeral()).isEqualTo("bv°*");
            assertThat(label("Ebaug", "C").numeral()).isEqualTo("bIII+*");
        }

        @Test
        @DisplayName("해석할 수 없는 근음 → ?")
        void unresolvable_root() {
            assertThat(label("Cb", "C")).isEqualTo(new AnalysisEntry("Cb", "?", "Unknown", false));
        }
    }

    @Test
    void decorate_applies_case_and_suffix() {
        assertThat(NumeralGenerator.decorate("IV", parser.parse("Fm7").orElseThrow())).isEqualTo("iv7");
        assertThat(NumeralGenerator.decorate("bIII", parser.parse("EbM7").orElseThrow())).isEqualTo("bIIImaj7");
    }
}
