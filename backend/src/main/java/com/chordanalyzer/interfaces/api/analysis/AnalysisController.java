package com.chordanalyzer.interfaces.api.analysis;

import com.chordanalyzer.application.analysis.ChordAnalysisAppService;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.MidiExport;
import com.chordanalyzer.interfaces.api.dto.AnalysisRequest;
import com.chordanalyzer.interfaces.api.dto.AnalysisResponse;
import com.chordanalyzer.interfaces.api.dto.ExampleProgressionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private static final MediaType AUDIO_MIDI = MediaType.parseMediaType("audio/midi");

    private final ChordAnalysisAppService chordAnalysisAppService;

    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        AnalysisResult result = chordAnalysisAppService.analyze(request.progression());
        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    @GetMapping("/examples")
    public ResponseEntity<List<ExampleProgressionResponse>> examples() {
        List<ExampleProgressionResponse> examples = chordAnalysisAppService.examples().stream()
                .map(ExampleProgressionResponse::from)
                .toList();
        return ResponseEntity.ok(examples);
    }

    @PostMapping("/midi")
    public ResponseEntity<byte[]> exportMidi(@Valid @RequestBody AnalysisRequest request) {
        MidiExport export = chordAnalysisAppService.exportMidi(request.progression());
        return ResponseEntity.ok()
                .contentType(AUDIO_MIDI)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(export.fileName()).build().toString())
                .body(export.bytes());
    }
}
