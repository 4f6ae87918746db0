package com.chordanalyzer.infrastructure.midi;

import com.chordanalyzer.domain.analysis.model.AnalysisEntry;
import com.chordanalyzer.domain.analysis.model.AnalysisResult;
import com.chordanalyzer.domain.analysis.model.Chord;
import com.chordanalyzer.domain.analysis.model.MidiExport;
import com.chordanalyzer.infrastructure.analysis.parsing.ChordParser;
import com.chordanalyzer.infrastructure.analysis.theory.NoteTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.MetaMessage;
import javax.sound.midi.MidiEvent;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.Sequence;
import javax.sound.midi.ShortMessage;
import javax.sound.midi.Track;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Renders an analysed progression as a one-track Standard MIDI File of block chords.
 * <p>
 * Each chord symbol is re-parsed and voiced as root (octave 2), fifth and a tenth (minor for minor and diminished chords),
 * every voice kept above the root. Numerals are not used; the key only names the file.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MidiExporter {

    private static final int META_TEMPO = 0x51;
    private static final int META_TRACK_NAME = 0x03;
    private static final int MIDI_FILE_TYPE = 1;
    private static final int CHANNEL = 0;
    private static final String DEFAULT_KEY = "C";

    private final ChordParser chordParser;

    @Value("${midi.tempo-bpm:120}")
    private int tempoBpm;

    @Value("${midi.ticks-per-beat:128}")
    private int ticksPerBeat;

    @Value("${midi.chord-duration-ticks:512}")
    private int chordDurationTicks;

    @Value("${midi.velocity:90}")
    private int velocity;

    public MidiExport export(AnalysisResult result) {
        String key = result.key() != null ? result.key() : DEFAULT_KEY;
        try {
            Sequence sequence = new Sequence(Sequence.PPQ, ticksPerBeat);
            Track track = sequence.createTrack();
            track.add(new MidiEvent(tempoMeta(tempoBpm), 0));
            track.add(new MidiEvent(textMeta(META_TRACK_NAME, "Progression in " + key), 0));

            long tick = 0;
            int written = 0;
            for (AnalysisEntry entry : result.analysis()) {
                Optional<Chord> chord = chordParser.parse(entry.chord());
                if (chord.isEmpty()) continue;

                int[] pitches = voicing(chord.get());
                if (pitches.length == 0) {
                    log.debug("[Midi] skipping chord with unknown root: {}", entry.chord());
                    continue;
                }
                for (int pitch : pitches) {
                    track.add(noteEvent(ShortMessage.NOTE_ON, pitch, velocity, tick));
                    track.add(noteEvent(ShortMessage.NOTE_OFF, pitch, 0, tick + chordDurationTicks));
                }
                tick += chordDurationTicks;
                written++;
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MidiSystem.write(sequence, MIDI_FILE_TYPE, out);
            log.info("[Midi] exported {} chords in {} ({} bytes)", written, key, out.size());
            return new MidiExport(fileName(key), out.toByteArray());
        } catch (InvalidMidiDataException e) {
            throw new MidiExportException("Cannot build MIDI sequence", e);
        } catch (IOException e) {
            throw new MidiExportException("Cannot write MIDI file", e);
        }
    }

    /**
     * MIDI pitches for root, fifth and tenth; empty if the root cannot be resolved.
     */
    static int[] voicing(Chord chord) {
        int root = NoteTable.noteIndex(chord.root());
        if (root == NoteTable.NOT_FOUND) {
            return new int[0];
        }

        int fifth = (root + 7) % 12;
        int fifthOctave = fifth <= root ? 3 : 2;

        int tenth = (root + (chord.isMinor() || chord.isDiminished() ? 3 : 4)) % 12;
        int tenthOctave = tenth <= root ? 4 : 3;

        return new int[]{
                midiPitch(root, 2),
                midiPitch(fifth, fifthOctave),
                midiPitch(tenth, tenthOctave)
        };
    }

    /**
     * "progression-in-Bflat.mid" style name; only the first '#' and first 'b' are spelled out.
     */
    static String fileName(String key) {
        String spelled = key.replaceFirst("#", "sharp").replaceFirst("b", "flat");
        return "progression-in-" + spelled + ".mid";
    }

    private static int midiPitch(int pitchClass, int octave) {
        return 12 * (octave + 1) + pitchClass;
    }

    private static MidiEvent noteEvent(int command, int pitch, int velocity, long tick)
            throws InvalidMidiDataException {
        return new MidiEvent(new ShortMessage(command, CHANNEL, pitch, velocity), tick);
    }

    private static MetaMessage tempoMeta(int bpm) throws InvalidMidiDataException {
        int mpqn = 60_000_000 / bpm;
        return new MetaMessage(META_TEMPO, new byte[]{
                (byte) (mpqn >> 16),
                (byte) (mpqn >> 8),
                (byte) mpqn}, 3);
    }

    private static MetaMessage textMeta(int type, String text) throws InvalidMidiDataException {
        byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
        return new MetaMessage(type, bytes, bytes.length);
    }
}
