package com.phillippitts.trackembed.service.embedding;

import com.phillippitts.trackembed.config.properties.EmbeddingModelProperties;
import com.phillippitts.trackembed.exception.EmbeddingModelException;
import com.phillippitts.trackembed.exception.ExternalProcessException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link EmbeddingModel} backed by an external inference command.
 *
 * <p>Each call gets its own temporary tensor file, so concurrent jobs never share output paths.
 * The command template is resolved per call and the configured list is never modified.
 */
public class ExternalProcessEmbeddingModel implements EmbeddingModel {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessEmbeddingModel.class);
    private static final String TOOL = "embedding-model";

    private final ExternalProcessRunner runner;
    private final List<String> commandTemplate;
    private final EmbeddingModelProperties props;

    public ExternalProcessEmbeddingModel(ExternalProcessRunner runner, EmbeddingModelProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
        this.commandTemplate = List.copyOf(props.getCommand());
        if (!commandTemplate.contains(EmbeddingModelProperties.INPUT_PLACEHOLDER)
                || !commandTemplate.contains(EmbeddingModelProperties.OUTPUT_PLACEHOLDER)) {
            throw new IllegalArgumentException("Embedding model command must contain "
                    + EmbeddingModelProperties.INPUT_PLACEHOLDER + " and "
                    + EmbeddingModelProperties.OUTPUT_PLACEHOLDER + ": " + commandTemplate);
        }
    }

    @Override
    public HiddenStates infer(Path normalizedWav) {
        String audio = String.valueOf(normalizedWav.getFileName());
        if (!Files.isRegularFile(normalizedWav)) {
            throw new EmbeddingModelException("Normalized audio not found", audio);
        }
        Path tensorFile = null;
        try {
            tensorFile = Files.createTempFile("hidden-states-", ".bin");
            runner.run(TOOL, resolveCommand(normalizedWav, tensorFile), null, props.getTimeout());
            HiddenStates states = HiddenStatesReader.read(tensorFile);
            LOG.debug("Inference for {} produced {} layers x {} steps x {} features",
                    audio, states.layers(), states.timeSteps(), states.featureWidth());
            return states;
        } catch (ExternalProcessException e) {
            throw new EmbeddingModelException("Inference failed: " + e.getMessage(), audio, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new EmbeddingModelException("Unreadable model output: " + e.getMessage(), audio, e);
        } finally {
            if (tensorFile != null) {
                try {
                    Files.deleteIfExists(tensorFile);
                } catch (IOException e) {
                    LOG.warn("Could not delete tensor file {}: {}", tensorFile, e.toString());
                }
            }
        }
    }

    @Override
    public String name() {
        return String.join(" ", commandTemplate);
    }

    List<String> resolveCommand(Path input, Path output) {
        List<String> cmd = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            cmd.add(part
                    .replace(EmbeddingModelProperties.INPUT_PLACEHOLDER, input.toAbsolutePath().toString())
                    .replace(EmbeddingModelProperties.OUTPUT_PLACEHOLDER, output.toAbsolutePath().toString()));
        }
        return cmd;
    }
}
