package com.chordanalyzer.domain.analysis.service;

import com.chordanalyzer.domain.analysis.model.AnalysisResult;

/**
 * Domain service interface for chord progression key detection and Roman-numeral analysis.
 */
public interface ChordAnalysisService {

    /**
     * Detects the key of a progression and labels every chord with a numeral and function.
     * Tokens that are not valid chord symbols are skipped silently.
     *
     * @param progression comma-separated chord symbols (e.g. "C, G, Am, F"), nullable
     * @return the analysis; key is null and the list empty when no chord could be parsed
     */
    AnalysisResult analyze(String progression);
}
