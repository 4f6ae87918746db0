package com.chordanalyzer.application.analysis;

import com.chordanalyzer.application.analysis.exception.EmptyProgressionException;
import com.chordanalyzer.application.analysis.exception.ProgressionTooLongException;
import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.MidiExport;
import com.chordanalyzer.domain.analysis.service.ChordAnalysisService;
import com.chordanalyzer.infrastructure.examples.ExampleProgressionRegistry;
import com.chordanalyzer.infrastructure.midi.MidiExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChordAnalysisAppServiceTest {

    @Mock
    private ChordAnalysisService chordAnalysisService;

    @Mock
    private MidiExporter midiExporter;

    private ChordAnalysisAppService service;

    @BeforeEach
    void setUp() throws Exception {
        service = new ChordAnalysisAppService(chordAnalysisService, midiExporter, new ExampleProgressionRegistry());
        Field field = ChordAnalysisAppService.class.getDeclaredField("maxInputLength");
        field.setAccessible(true);
        field.set(service, 20);
    }

    @Test
    @DisplayName("분석 결과를 그대로 반환")
    void 분석_위임() {
        AnalysisResult expected = new AnalysisResult("C", List.of(new AnalysisEntry("C", "I", "Tonic", true)));
        when(chordAnalysisService.analyze("C")).thenReturn(expected);

        assertThat(service.analyze("C")).isEqualTo(expected);
    }

    @Test
    @DisplayName("최대 길이 초과 → ProgressionTooLongException")
    void 길이_초과() {
        assertThatThrownBy(() -> service.analyze("C, G, Am, F, C, G, Am, F"))
                .isInstanceOf(ProgressionTooLongException.class)
                .hasMessageContaining("20");
        verify(chordAnalysisService, never()).analyze(anyString());
    }

    @Test
    @DisplayName("분석할 코드가 없으면 MIDI 생성 안 함")
    void 빈_진행_MIDI() {
        when(chordAnalysisService.analyze("H")).thenReturn(AnalysisResult.empty());

        assertThatThrownBy(() -> service.exportMidi("H"))
                .isInstanceOf(EmptyProgressionException.class);
        verify(midiExporter, never()).export(any());
    }

    @Test
    void MIDI_내보내기() {
        AnalysisResult analysed = new AnalysisResult("Bb", List.of(new AnalysisEntry("F", "V", "Dominant", true)));
        MidiExport export = new MidiExport("progression-in-Bflat.mid", new byte[]{1, 2, 3});
        when(chordAnalysisService.analyze("F")).thenReturn(analysed);
        when(midiExporter.export(analysed)).thenReturn(export);

        assertThat(service.exportMidi("F")).isSameAs(export);
    }

    @Test
    void 예제_목록() {
        assertThat(service.examples()).hasSize(10);
        assertThat(service.examples().get(0).chords()).isEqualTo("F, G, Am, C");
    }
}
