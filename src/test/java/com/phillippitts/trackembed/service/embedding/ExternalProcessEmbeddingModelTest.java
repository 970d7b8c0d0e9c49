package com.phillippitts.trackembed.service.embedding;

import com.phillippitts.trackembed.config.properties.EmbeddingModelProperties;
import com.phillippitts.trackembed.exception.EmbeddingModelException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import com.phillippitts.trackembed.testutil.TestProcesses.ProcessBehavior;
import com.phillippitts.trackembed.testutil.TestProcesses.ScriptedProcessFactory;
import com.phillippitts.trackembed.testutil.WavFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalProcessEmbeddingModelTest {

    @TempDir
    Path tmp;

    private Path wav;
    private EmbeddingModelProperties props;

    @BeforeEach
    void setUp() throws IOException {
        wav = WavFiles.writeModelFormat(tmp.resolve("Song - Artist.wav"));
        props = new EmbeddingModelProperties();
        props.setCommand(List.of("runner", "--in", "{input}", "--out={output}"));
    }

    @Test
    void readsTensorWrittenByRunner() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory((cmd, dir) -> {
            String out = cmd.get(3).substring("--out=".length());
            TensorFiles.write(Path.of(out), 13, 5, 1024, 0.5f);
            return ProcessBehavior.ok("");
        });
        ExternalProcessEmbeddingModel model = new ExternalProcessEmbeddingModel(new ExternalProcessRunner(factory), props);

        HiddenStates states = model.infer(wav);

        assertThat(states.shape()).containsExactly(13, 5, 1024);
        List<String> cmd = factory.commands().get(0);
        assertThat(cmd.get(2)).isEqualTo(wav.toAbsolutePath().toString());
        assertThat(Path.of(cmd.get(3).substring("--out=".length()))).doesNotExist();
    }

    @Test
    void concurrentCallsUseDistinctOutputFiles() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory((cmd, dir) -> {
            TensorFiles.write(Path.of(cmd.get(3).substring("--out=".length())), 1, 1, 2, 1f);
            return ProcessBehavior.ok("");
        });
        ExternalProcessEmbeddingModel model = new ExternalProcessEmbeddingModel(new ExternalProcessRunner(factory), props);

        model.infer(wav);
        model.infer(wav);

        assertThat(factory.commands().get(0).get(3)).isNotEqualTo(factory.commands().get(1).get(3));
        assertThat(props.getCommand()).containsExactly("runner", "--in", "{input}", "--out={output}");
    }

    @Test
    void runnerFailureBecomesModelException() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(ProcessBehavior.exit(1, "CUDA out of memory"));
        ExternalProcessEmbeddingModel model = new ExternalProcessEmbeddingModel(new ExternalProcessRunner(factory), props);

        assertThatThrownBy(() -> model.infer(wav))
                .isInstanceOf(EmbeddingModelException.class)
                .hasMessageContaining("Inference failed")
                .hasMessageContaining("Song - Artist.wav");
    }

    @Test
    void missingOutputBecomesModelException() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory((cmd, dir) -> {
            Files.write(Path.of(cmd.get(3).substring("--out=".length())), new byte[0]);
            return ProcessBehavior.ok("");
        });
        ExternalProcessEmbeddingModel model = new ExternalProcessEmbeddingModel(new ExternalProcessRunner(factory), props);

        assertThatThrownBy(() -> model.infer(wav))
                .isInstanceOf(EmbeddingModelException.class)
                .hasMessageContaining("Unreadable model output");
    }

    @Test
    void missingAudioFails() {
        ExternalProcessEmbeddingModel model = new ExternalProcessEmbeddingModel(
                new ExternalProcessRunner(ScriptedProcessFactory.always(ProcessBehavior.ok(""))), props);

        assertThatThrownBy(() -> model.infer(tmp.resolve("missing.wav")))
                .isInstanceOf(EmbeddingModelException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void commandWithoutPlaceholdersIsRejected() {
        props.setCommand(List.of("runner", "in.wav"));

        assertThatThrownBy(() -> new ExternalProcessEmbeddingModel(new ExternalProcessRunner(), props))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
