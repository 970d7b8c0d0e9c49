package com.phillippitts.trackembed.service.audio;

import com.phillippitts.trackembed.config.properties.AudioNormalizationProperties;
import com.phillippitts.trackembed.exception.ExternalProcessException;
import com.phillippitts.trackembed.exception.InvalidAudioException;
import com.phillippitts.trackembed.exception.TrackEmbedException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Transcodes downloaded preview clips into the model format with an external transcoder.
 *
 * <p>Every output is mono, {@value AudioFormat#MODEL_SAMPLE_RATE} Hz, 16-bit PCM and truncated to the
 * first {@value AudioFormat#MAX_DURATION_SECONDS} seconds. Output names are the input stem with a
 * {@code .wav} extension, so repeated runs overwrite earlier outputs.
 */
public class AudioNormalizer {

    private static final Logger LOG = LogManager.getLogger(AudioNormalizer.class);
    private static final String TOOL = "ffmpeg";

    private final ExternalProcessRunner runner;
    private final WavInspector inspector;
    private final AudioNormalizationProperties props;

    public AudioNormalizer(ExternalProcessRunner runner, WavInspector inspector,
                           AudioNormalizationProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Normalizes every file with the given extension in {@code inputDir}.
     * A clip that fails to decode or transcode is logged and left out of the result.
     *
     * @param inputDir directory of downloaded clips
     * @param outputDir directory receiving the normalized WAV files (created if missing)
     * @param inputExtension extension of the clips to pick up, e.g. ".mp3"
     * @return normalized clips, in file-name order
     * @throws TrackEmbedException when the input directory does not exist or cannot be listed
     */
    public List<NormalizedAudio> normalizeDirectory(Path inputDir, Path outputDir, String inputExtension) {
        if (!Files.isDirectory(inputDir)) {
            throw new TrackEmbedException("Input directory not found: " + inputDir);
        }
        List<Path> inputs = listInputs(inputDir, inputExtension);
        createDirectories(outputDir);

        List<NormalizedAudio> converted = new ArrayList<>(inputs.size());
        for (Path input : inputs) {
            try {
                converted.add(normalize(input, outputDir));
            } catch (InvalidAudioException e) {
                LOG.error("Failed to convert {}: {}", input.getFileName(), e.getMessage());
            }
        }
        LOG.info("Converted {} of {} clips in {}", converted.size(), inputs.size(), inputDir);
        return converted;
    }

    /**
     * Normalizes a single clip.
     *
     * @param input downloaded clip
     * @param outputDir directory receiving {@code <stem>.wav}
     * @return the normalized clip
     * @throws InvalidAudioException when the clip cannot be transcoded or the output is not in
     *         the model format
     */
    public NormalizedAudio normalize(Path input, Path outputDir) {
        if (!Files.isRegularFile(input)) {
            throw new InvalidAudioException(input, "Input file not found");
        }
        Path output = outputDir.resolve(stem(input) + AudioFormat.NORMALIZED_EXTENSION);

        LOG.debug("Converting {} to {}", input.getFileName(), output.getFileName());
        try {
            runner.run(TOOL, buildCommand(input, output), null, props.getTimeout());
            WavInfo info = inspector.requireModelFormat(output);
            return new NormalizedAudio(input, output, info);
        } catch (ExternalProcessException e) {
            deleteQuietly(output);
            throw new InvalidAudioException(input, "Transcode failed: " + e.getMessage(), e);
        } catch (InvalidAudioException e) {
            deleteQuietly(output);
            throw e;
        }
    }

    List<String> buildCommand(Path input, Path output) {
        return List.of(
                props.getFfmpegPath(),
                "-hide_banner",
                "-loglevel", "warning",
                "-y",
                "-i", input.toAbsolutePath().toString(),
                "-t", String.valueOf(AudioFormat.MAX_DURATION_SECONDS),
                "-ar", String.valueOf(AudioFormat.MODEL_SAMPLE_RATE),
                "-ac", String.valueOf(AudioFormat.MODEL_CHANNELS),
                "-c:a", "pcm_s16le",
                output.toAbsolutePath().toString());
    }

    /**
     * @return file name without its last extension
     */
    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<Path> listInputs(Path inputDir, String extension) {
        String suffix = extension.toLowerCase(Locale.ROOT);
        List<Path> inputs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p) && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix)) {
                    inputs.add(p);
                }
            }
        } catch (IOException e) {
            throw new TrackEmbedException("Cannot list " + inputDir + ": " + e.getMessage(), e);
        }
        inputs.sort(null);
        return inputs;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TrackEmbedException("Cannot create " + dir + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not remove partial output {}: {}", file, e.toString());
        }
    }
}
