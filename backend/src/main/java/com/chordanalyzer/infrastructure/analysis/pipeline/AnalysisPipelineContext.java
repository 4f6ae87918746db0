package com.chordanalyzer.infrastructure.analysis.pipeline;

import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.infrastructure.analysis.detection.ChordProfile;
import com.chordanalyzer.infrastructure.analysis.detection.KeyProposals;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context object passed through pipeline stages.
 * Created per call and discarded afterwards.
 */
@Data
public class AnalysisPipelineContext {

    // --- Input ---
    private String progression;

    // --- Parsing ---
    private List<Chord> chords = new ArrayList<>();
    private ChordProfile profile;

    // --- Detection ---
    private KeyProposals proposals = KeyProposals.none();

    // --- Scoring (canonical spelling) ---
    private String key;

    // --- Labeling ---
    private List<AnalysisEntry> entries = new ArrayList<>();

    public AnalysisResult toAnalysisResult() {
        if (key == null) {
            return AnalysisResult.empty();
        }
        return new AnalysisResult(NoteTable.preferredKeySpelling(key), List.copyOf(entries));
    }
}
