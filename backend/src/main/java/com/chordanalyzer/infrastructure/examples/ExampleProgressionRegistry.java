package com.chordanalyzer.infrastructure.examples;

import com.chordanalyzer.domain.analysis.model.ExampleProgression;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Quick-select progressions from popular songs, transposed to C.
 * The expected keys are reference labels for the UI, not engine assertions.
 */
@Component
public class ExampleProgressionRegistry {

    private final List<ExampleProgression> examples = new ArrayList<>();

    public ExampleProgressionRegistry() {
        register("Jon Bellion - All Time Low (C)", "F, G, Am, C", "C");
        register("Radiohead - Everything In Its Right Place (Ab)", "C, Db, Eb", "E");
        register("London Grammar - Hey Now (C)", "F, Am, G, D", "C");
        register("Deadmau5 - I Remember (C)", "Am, C, Em, G", "C");
        register("Avicii - Levels (C)", "Am, C, F", "C");
        register("Boards of Canada - Olson (C)", "F, G, D", "C");
        register("Above & Beyond - Sun & Moon (C)", "Am, C, Am, F", "C");
        register("Koven & Circadian - The Outlines (C)", "Em, F, G", "C");
        register("Charli XCX - Von Dutch (C)", "Am, C, G, Am, D", "C");
        register("Skeler - ID 1 (C)", "Dm, Em, F", "C");
    }

    private void register(String name, String chords, String expectedKey) {
        examples.add(new ExampleProgression(name, chords, expectedKey));
    }

    public List<ExampleProgression> all() {
        return Collections.unmodifiableList(examples);
    }
}
