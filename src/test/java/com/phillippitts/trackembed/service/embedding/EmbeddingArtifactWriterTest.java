package com.phillippitts.trackembed.service.embedding;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingArtifactWriterTest {

    @TempDir
    Path tmp;

    @Test
    void writesOneDocumentPerUser() throws IOException {
        EmbeddingArtifactWriter writer = new EmbeddingArtifactWriter(tmp.resolve("embeddings"));
        EmbeddingArtifactEntry entry = new EmbeddingArtifactEntry("t1", Path.of("wav/a.wav"),
                new ReducedEmbedding(new float[][] {{0.25f, -1f}}, 12, ReductionPolicy.MEAN),
                new int[] {13, 374, 2});

        Path out = writer.write("alice", "mert", List.of(entry));

        assertThat(out).isEqualTo(tmp.resolve("embeddings").resolve("alice_embeddings.json"));
        JSONObject doc = new JSONObject(Files.readString(out));
        assertThat(doc.getString("user_id")).isEqualTo("alice");
        assertThat(doc.getString("model")).isEqualTo("mert");
        assertThat(doc.has("generated_at")).isTrue();
        JSONObject item = doc.getJSONArray("embeddings").getJSONObject(0);
        assertThat(item.getString("track_id")).isEqualTo("t1");
        assertThat(item.getString("reduction")).isEqualTo("MEAN");
        assertThat(item.getInt("layer")).isEqualTo(12);
        assertThat(item.getJSONArray("shape").toList()).containsExactly(13, 374, 2);
        JSONArray vector = item.getJSONArray("vector");
        assertThat(vector.getFloat(0)).isEqualTo(0.25f);
        assertThat(vector.getFloat(1)).isEqualTo(-1f);
    }

    @Test
    void unreducedEntriesCarryFrames() throws IOException {
        EmbeddingArtifactWriter writer = new EmbeddingArtifactWriter(tmp);
        EmbeddingArtifactEntry entry = new EmbeddingArtifactEntry("t2", Path.of("b.wav"),
                new ReducedEmbedding(new float[][] {{1f}, {2f}}, 0, ReductionPolicy.NONE), new int[] {1, 2, 1});

        JSONObject item = new JSONObject(Files.readString(writer.write("bob", "m", List.of(entry))))
                .getJSONArray("embeddings").getJSONObject(0);

        assertThat(item.has("vector")).isFalse();
        assertThat(item.getJSONArray("frames").length()).isEqualTo(2);
    }

    @Test
    void rewriteReplacesPreviousArtifactAndLeavesNoTempFiles() throws IOException {
        EmbeddingArtifactWriter writer = new EmbeddingArtifactWriter(tmp);
        writer.write("carol", "m", List.of());
        writer.write("carol", "m", List.of());

        try (var files = Files.list(tmp)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("carol_embeddings.json");
        }
        assertThat(new JSONObject(Files.readString(writer.locationFor("carol")))
                .getJSONArray("embeddings").isEmpty()).isTrue();
    }
}
