package com.phillippitts.trackembed.service.audio;

import com.phillippitts.trackembed.config.properties.AudioNormalizationProperties;
import com.phillippitts.trackembed.exception.InvalidAudioException;
import com.phillippitts.trackembed.exception.TrackEmbedException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import com.phillippitts.trackembed.testutil.TestProcesses.ProcessBehavior;
import com.phillippitts.trackembed.testutil.TestProcesses.ScriptedProcessFactory;
import com.phillippitts.trackembed.testutil.WavFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioNormalizerTest {

    @TempDir
    Path tmp;

    /** Stands in for ffmpeg: writes a model-format WAV to the last argument, or fails for "broken" inputs. */
    private static ScriptedProcessFactory fakeTranscoder() {
        return new ScriptedProcessFactory((cmd, dir) -> {
            String input = cmd.get(cmd.indexOf("-i") + 1);
            if (input.contains("broken")) {
                return ProcessBehavior.exit(1, "Invalid data found when processing input");
            }
            WavFiles.writeModelFormat(Path.of(cmd.get(cmd.size() - 1)));
            return ProcessBehavior.ok("");
        });
    }

    private AudioNormalizer normalizer(ScriptedProcessFactory factory) {
        return new AudioNormalizer(new ExternalProcessRunner(factory), new WavInspector(),
                new AudioNormalizationProperties());
    }

    @Test
    void buildsTruncatingMonoCommand() {
        AudioNormalizer normalizer = normalizer(fakeTranscoder());

        List<String> cmd = normalizer.buildCommand(Path.of("/in/Song - Artist.mp3"), Path.of("/out/Song - Artist.wav"));

        assertThat(cmd).startsWith("ffmpeg");
        assertThat(cmd).containsSequence("-t", "15");
        assertThat(cmd).containsSequence("-ar", "24000");
        assertThat(cmd).containsSequence("-ac", "1");
        assertThat(cmd).containsSequence("-c:a", "pcm_s16le");
        assertThat(cmd).contains("-y");
        assertThat(cmd.get(cmd.size() - 1)).endsWith("Song - Artist.wav");
    }

    @Test
    void normalizesDirectoryInNameOrderAndSkipsFailures() throws IOException {
        Path in = Files.createDirectories(tmp.resolve("previews"));
        Files.write(in.resolve("b - two.mp3"), new byte[]{1});
        Files.write(in.resolve("a - one.mp3"), new byte[]{1});
        Files.write(in.resolve("broken.mp3"), new byte[]{1});
        Files.write(in.resolve("notes.txt"), new byte[]{1});
        Path out = tmp.resolve("wav");

        List<NormalizedAudio> result = normalizer(fakeTranscoder()).normalizeDirectory(in, out, ".mp3");

        assertThat(result).extracting(NormalizedAudio::stem).containsExactly("a - one", "b - two");
        assertThat(out.resolve("a - one.wav")).exists();
        assertThat(out.resolve("broken.wav")).doesNotExist();
        assertThat(result.get(0).info().sampleRate()).isEqualTo(24_000);
    }

    @Test
    void failedTranscodeRemovesPartialOutput() throws IOException {
        Path in = Files.write(tmp.resolve("broken.mp3"), new byte[]{1});
        Path out = Files.createDirectories(tmp.resolve("wav"));
        Files.write(out.resolve("broken.wav"), new byte[]{0, 0});

        assertThatThrownBy(() -> normalizer(fakeTranscoder()).normalize(in, out))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("Transcode failed");
        assertThat(out.resolve("broken.wav")).doesNotExist();
    }

    @Test
    void outputInWrongFormatIsRejected() throws IOException {
        ScriptedProcessFactory wrongRate = new ScriptedProcessFactory((cmd, dir) -> {
            WavFiles.write(Path.of(cmd.get(cmd.size() - 1)), 44_100, 2, 16, 1.0);
            return ProcessBehavior.ok("");
        });
        Path in = Files.write(tmp.resolve("x.mp3"), new byte[]{1});

        assertThatThrownBy(() -> normalizer(wrongRate).normalize(in, tmp))
                .isInstanceOf(InvalidAudioException.class);
        assertThat(tmp.resolve("x.wav")).doesNotExist();
    }

    @Test
    void missingInputDirectoryFails() {
        assertThatThrownBy(() -> normalizer(fakeTranscoder())
                .normalizeDirectory(tmp.resolve("nope"), tmp.resolve("wav"), ".mp3"))
                .isInstanceOf(TrackEmbedException.class)
                .hasMessageContaining("Input directory not found");
    }

    @Test
    void stemDropsOnlyLastExtension() {
        assertThat(AudioNormalizer.stem(Path.of("Mr. Brightside - The Killers.mp3")))
                .isEqualTo("Mr. Brightside - The Killers");
        assertThat(AudioNormalizer.stem(Path.of("noext"))).isEqualTo("noext");
    }
}
