package com.chordanalyzer.infrastructure.examples;

import com.chordanalyzer.domain.analysis.model.ExampleProgression;
import com.chordanalyzer.infrastructure.analysis.parsing.ChordParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExampleProgressionRegistryTest {

    private final ExampleProgressionRegistry registry = new ExampleProgressionRegistry();

    @Test
    @DisplayName("모든 예제 코드는 파싱 가능")
    void 예제_파싱() {
        ChordParser parser = new ChordParser();
        for (ExampleProgression example : registry.all()) {
            int tokens = example.chords().split(",").length;
            assertThat(parser.parseProgression(example.chords()))
                    .as(example.name())
                    .hasSize(tokens);
        }
    }

    @Test
    void 순서_고정() {
        assertThat(registry.all()).extracting(ExampleProgression::name)
                .startsWith("Jon Bellion - All Time Low (C)", "Radiohead - Everything In Its Right Place (Ab)");
    }

    @Test
    void 수정_불가() {
        assertThatThrownBy(() -> registry.all().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
