package com.chordanalyzer.infrastructure.analysis.pipeline;

import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.domain.analysis.service.ChordAnalysisService;
import com.chordanalyzer.infrastructure.analysis.detection.ChordProfile;
import com.chordanalyzer.infrastructure.analysis.detection.FourthPairDetector;
import com.chordanalyzer.infrastructure.analysis.detection.KeyProposals;
import com.chordanalyzer.infrastructure.analysis.detection.RotationDetector;
import com.chordanalyzer.infrastructure.analysis.detection.SubmediantDetector;
import com.chordanalyzer.infrastructure.analysis.numeral.NumeralGenerator;
import com.chordanalyzer.infrastructure.analysis.parsing.ChordParser;
import com.chordanalyzer.infrastructure.analysis.scoring.CandidateScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orchestrates the analysis pipeline:
 * <p>
 * parse → profile → pattern detection → key scoring → numeral labeling
 * </p>
 * Pure and synchronous; the only shared state is the immutable note table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyAnalysisPipeline implements ChordAnalysisService {

    private final ChordParser chordParser;
    private final RotationDetector rotationDetector;
    private final FourthPairDetector fourthPairDetector;
    private final SubmediantDetector submediantDetector;
    private final CandidateScorer candidateScorer;
    private final NumeralGenerator numeralGenerator;

    @Override
    public AnalysisResult analyze(String progression) {
        AnalysisPipelineContext ctx = new AnalysisPipelineContext();
        ctx.setProgression(progression);

        // 1. Parse
        parse(ctx);
        if (ctx.getChords().isEmpty()) {
            log.debug("[Pipeline] no parseable chords in '{}'", progression);
            return ctx.toAnalysisResult();
        }

        // 2. Pattern detection
        detectPatterns(ctx);

        // 3. Key selection
        selectKey(ctx);

        // 4. Numerals
        label(ctx);

        return ctx.toAnalysisResult();
    }

    private void parse(AnalysisPipelineContext ctx) {
        ctx.setChords(chordParser.parseProgression(ctx.getProgression()));
        ctx.setProfile(ChordProfile.from(ctx.getChords()));
    }

    private void detectPatterns(AnalysisPipelineContext ctx) {
        ChordProfile profile = ctx.getProfile();
        KeyProposals proposals = new KeyProposals(
                submediantDetector.detect(profile).orElse(null),
                fourthPairDetector.detect(profile).orElse(null),
                rotationDetector.detect(ctx.getChords())
        );
        ctx.setProposals(proposals);
        log.debug("[Pipeline] proposals: submediant={}, fourthPair={}, rotation={} (x{})",
                proposals.submediantKey(), proposals.fourthPairKey(),
                proposals.rotation().bestKey(), proposals.rotation().bestCount());
    }

    private void selectKey(AnalysisPipelineContext ctx) {
        ctx.setKey(candidateScorer.selectKey(ctx.getProfile(), ctx.getProposals()).orElse(null));
    }

    private void label(AnalysisPipelineContext ctx) {
        if (ctx.getKey() == null) {
            return;
        }
        for (Chord chord : ctx.getChords()) {
            ctx.getEntries().add(numeralGenerator.label(chord, ctx.getKey()));
        }
    }
}
