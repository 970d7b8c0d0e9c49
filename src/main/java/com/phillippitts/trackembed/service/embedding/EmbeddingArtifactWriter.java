package com.phillippitts.trackembed.service.embedding;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@code <artifact-dir>/<userId>_embeddings.json}, one file per user, replaced on every
 * completed job.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "user_id": "...",
 *   "generated_at": "2024-05-01T10:00:00Z",
 *   "model": "...",
 *   "embeddings": [
 *     {"track_id": "...", "audio_file": "...", "layer": 12, "reduction": "MEAN",
 *      "shape": [13, 374, 1024], "vector": [...]}
 *   ]
 * }
 * </pre>
 */
public class EmbeddingArtifactWriter {

    private static final Logger LOG = LogManager.getLogger(EmbeddingArtifactWriter.class);
    static final String FILE_SUFFIX = "_embeddings.json";

    private final Path artifactDir;

    public EmbeddingArtifactWriter(Path artifactDir) {
        this.artifactDir = Objects.requireNonNull(artifactDir, "artifactDir");
    }

    /**
     * @return location the artifact for {@code userId} is written to
     */
    public Path locationFor(String userId) {
        return artifactDir.resolve(userId + FILE_SUFFIX);
    }

    /**
     * Writes the artifact through a temporary sibling file so readers never see a partial document.
     *
     * @return path of the written artifact
     * @throws IOException if the directory or file cannot be written
     */
    public Path write(String userId, String modelName, List<EmbeddingArtifactEntry> entries) throws IOException {
        Files.createDirectories(artifactDir);
        JSONObject doc = new JSONObject();
        doc.put("user_id", userId);
        doc.put("generated_at", Instant.now().toString());
        doc.put("model", modelName);

        JSONArray items = new JSONArray();
        for (EmbeddingArtifactEntry entry : entries) {
            items.put(toJson(entry));
        }
        doc.put("embeddings", items);

        Path target = locationFor(userId);
        Path tmp = Files.createTempFile(artifactDir, userId + "-", ".json.tmp");
        try {
            Files.writeString(tmp, doc.toString(), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Wrote {} embeddings to {}", entries.size(), target);
        return target;
    }

    private static JSONObject toJson(EmbeddingArtifactEntry entry) {
        ReducedEmbedding reduced = entry.embedding();
        JSONObject obj = new JSONObject();
        obj.put("track_id", entry.trackId());
        obj.put("audio_file", String.valueOf(entry.audioFile()));
        obj.put("layer", reduced.layer());
        obj.put("reduction", reduced.policy().name());
        JSONArray shape = new JSONArray();
        for (int dim : entry.shape()) {
            shape.put(dim);
        }
        obj.put("shape", shape);
        if (reduced.isReduced()) {
            obj.put("vector", toJson(reduced.vector()));
        } else {
            JSONArray frames = new JSONArray();
            for (float[] frame : reduced.frames()) {
                frames.put(toJson(frame));
            }
            obj.put("frames", frames);
        }
        return obj;
    }

    static JSONArray toJson(float[] vector) {
        JSONArray arr = new JSONArray();
        for (float v : vector) {
            arr.put(v);
        }
        return arr;
    }
}
