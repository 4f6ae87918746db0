package com.chordanalyzer.application.analysis;

import com.chordanalyzer.application.analysis.exception.EmptyProgressionException;
import com.chordanalyzer.application.analysis.exception.ProgressionTooLongException;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.ExampleProgression;
import com.chordanalyzer.domain.analysis.model.MidiExport;
import com.chordanalyzer.domain.analysis.service.ChordAnalysisService;
import com.chordanalyzer.infrastructure.examples.ExampleProgressionRegistry;
import com.chordanalyzer.infrastructure.midi.MidiExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChordAnalysisAppService {

    private final ChordAnalysisService chordAnalysisService;
    private final MidiExporter midiExporter;
    private final ExampleProgressionRegistry exampleProgressionRegistry;

    @Value("${analysis.max-input-length:500}")
    private int maxInputLength;

    /**
     * Analyse a progression after enforcing the input length limit.
     */
    public AnalysisResult analyze(String progression) {
        validateLength(progression);

        long start = System.currentTimeMillis();
        AnalysisResult result = chordAnalysisService.analyze(progression);
        log.info("[Analysis] key={}, chords={}, nonDiatonic={}, {}ms",
                result.key(),
                result.analysis().size(),
                result.analysis().stream().filter(e -> !e.diatonic()).count(),
                System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Analyse, then render the progression as a MIDI file named after the detected key.
     */
    public MidiExport exportMidi(String progression) {
        AnalysisResult result = analyze(progression);
        if (result.analysis().isEmpty()) {
            throw new EmptyProgressionException();
        }
        return midiExporter.export(result);
    }

    public List<ExampleProgression> examples() {
        return exampleProgressionRegistry.all();
    }

    private void validateLength(String progression) {
        if (progression != null && progression.length() > maxInputLength) {
            throw new ProgressionTooLongException(maxInputLength);
        }
    }
}
